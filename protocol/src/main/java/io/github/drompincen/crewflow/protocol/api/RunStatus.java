package io.github.drompincen.crewflow.protocol.api;

public enum RunStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
