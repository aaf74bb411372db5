package io.github.drompincen.crewflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ThinkTrigger {
    SCHEDULED("scheduled"),
    MESSAGE_RECEIVED("message_received"),
    PLANNING_CYCLE("planning_cycle"),
    MANUAL("manual");

    private final String value;

    ThinkTrigger(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ThinkTrigger fromValue(String value) {
        if (value == null) return null;
        for (ThinkTrigger trigger : values()) {
            if (trigger.value.equalsIgnoreCase(value) || trigger.name().equalsIgnoreCase(value)) {
                return trigger;
            }
        }
        throw new IllegalArgumentException("Unknown think trigger: " + value);
    }
}
