package io.github.drompincen.crewflow.protocol.event;

/**
 * Payload of {@link EventNames#PLANNING_CYCLE}; {@code initiatedBy} is an agent id or "system".
 */
public record PlanningCyclePayload(
        String projectId,
        String initiatedBy
) {}
