package io.github.drompincen.crewflow.protocol.api;

public enum AgentType {
    OPTIMIZER,
    MANAGER,
    DEVELOPER
}
