package io.github.drompincen.crewflow.protocol.api;

/**
 * What one agent produced during a planning cycle step.
 */
public record AgentTurnSummary(
        String agentId,
        String ownerId,
        int actions,
        int messagesSent,
        int decisionsProposed
) {}
