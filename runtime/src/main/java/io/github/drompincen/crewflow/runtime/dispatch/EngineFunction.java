package io.github.drompincen.crewflow.runtime.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A durable function executed by the dispatcher. {@link #execute} may run more than once for the
 * same run; work wrapped in {@link StepRunner} steps runs at most once to completion.
 */
public interface EngineFunction<R> {

    FunctionConfig config();

    R execute(FunctionContext context);

    /**
     * Event data of a queued run after {@code incoming} was merged into it. Keeps the queued data
     * unless a function needs something from the later event.
     */
    default JsonNode coalesce(JsonNode queued, JsonNode incoming) {
        return queued;
    }
}
