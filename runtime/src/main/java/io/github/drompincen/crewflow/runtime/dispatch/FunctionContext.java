package io.github.drompincen.crewflow.runtime.dispatch;

import io.github.drompincen.crewflow.protocol.event.EngineEvent;

public record FunctionContext(String runId, EngineEvent event, int attempt, StepRunner step) {
}
