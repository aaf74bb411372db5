package io.github.drompincen.crewflow.runtime.dispatch;

import io.github.drompincen.crewflow.protocol.event.EngineEvent;

import java.util.List;

public interface EventDispatcher {

    /**
     * Queues a run of every function subscribed to the event. Returns the run ids, which may
     * include an existing queued run the event was merged into.
     */
    List<String> send(EngineEvent event);

    List<String> sendBatch(List<EngineEvent> events);

    /** Queues a run of one function with a cron event, bypassing subscriptions. */
    String invoke(String functionId);
}
