package io.github.drompincen.crewflow.protocol.api;

public record HeartbeatResult(
        CycleStatus status,
        int dueCount,
        int dispatched
) {
    public static HeartbeatResult noAgentsDue() {
        return new HeartbeatResult(CycleStatus.NO_AGENTS_DUE, 0, 0);
    }
}
