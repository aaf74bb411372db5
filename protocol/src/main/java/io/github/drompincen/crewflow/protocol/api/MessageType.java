package io.github.drompincen.crewflow.protocol.api;

public enum MessageType {
    HELP_REQUEST,
    TASK_OFFER,
    NEGOTIATION_PROPOSAL,
    STATUS_UPDATE,
    ALERT,
    BROADCAST
}
