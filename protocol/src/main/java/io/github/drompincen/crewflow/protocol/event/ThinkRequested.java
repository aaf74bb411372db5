package io.github.drompincen.crewflow.protocol.event;

/**
 * Application event asking for an immediate think cycle of one agent.
 */
public record ThinkRequested(String agentId) {}
