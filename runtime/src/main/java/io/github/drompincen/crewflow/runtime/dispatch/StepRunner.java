package io.github.drompincen.crewflow.runtime.dispatch;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.concurrent.Callable;

public interface StepRunner {

    /**
     * Runs {@code body} once and checkpoints its JSON result under {@code name}. When the run is
     * retried, a checkpointed step returns the stored result without running the body again.
     */
    <T> T run(String name, Class<T> type, Callable<T> body);

    <T> T run(String name, TypeReference<T> type, Callable<T> body);
}
