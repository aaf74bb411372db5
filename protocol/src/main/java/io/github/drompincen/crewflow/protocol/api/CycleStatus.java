package io.github.drompincen.crewflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome reported by the think, planning and heartbeat functions.
 */
public enum CycleStatus {
    COMPLETED("completed"),
    SKIPPED("skipped"),
    TRIGGERED("triggered"),
    NO_AGENTS_DUE("no-agents-due");

    private final String value;

    CycleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
