package io.github.drompincen.crewflow.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.Instant;
import java.util.UUID;

/**
 * A named event with a JSON payload, as accepted by the event dispatcher.
 */
public record EngineEvent(
        String eventId,
        String name,
        JsonNode data,
        Instant timestamp
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    public static EngineEvent of(String name, Object payload) {
        JsonNode data = payload instanceof JsonNode node ? node : OBJECT_MAPPER.valueToTree(payload);
        return new EngineEvent(UUID.randomUUID().toString(), name, data, Instant.now());
    }

    public static EngineEvent think(ThinkAgentPayload payload) {
        return of(EventNames.THINK, payload);
    }

    public static EngineEvent planningCycle(PlanningCyclePayload payload) {
        return of(EventNames.PLANNING_CYCLE, payload);
    }

    public static EngineEvent cron(String functionId) {
        return of(EventNames.CRON, OBJECT_MAPPER.createObjectNode().put("functionId", functionId));
    }
}
