package io.github.drompincen.crewflow.protocol.api;

public enum AgentStatus {
    ACTIVE,
    PAUSED,
    ARCHIVED
}
