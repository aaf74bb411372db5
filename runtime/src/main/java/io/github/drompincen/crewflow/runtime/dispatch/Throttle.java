package io.github.drompincen.crewflow.runtime.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * At most {@code limit} run starts per {@code period} for each distinct value of the
 * {@code keyField} found in the event data.
 */
public record Throttle(String keyField, int limit, Duration period) {

    public String keyFor(JsonNode data) {
        if (data == null) return null;
        JsonNode value = data.path(keyField);
        if (value.isMissingNode() || value.isNull() || value.asText().isBlank()) return null;
        return value.asText();
    }
}
