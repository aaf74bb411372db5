package io.github.drompincen.crewflow.protocol.api;

/**
 * Read state of a direct message. Broadcasts stay PENDING and track their readers instead.
 */
public enum MessageStatus {
    PENDING,
    ACKNOWLEDGED
}
