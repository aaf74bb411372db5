package io.github.drompincen.crewflow.protocol.api;

public enum DecisionStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    MODIFIED;

    /** Accepted and modified decisions both count towards an agent's trust score. */
    public boolean countsAsAccepted() {
        return this == ACCEPTED || this == MODIFIED;
    }
}
