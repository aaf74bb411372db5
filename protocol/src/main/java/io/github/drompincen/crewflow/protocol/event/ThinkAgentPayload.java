package io.github.drompincen.crewflow.protocol.event;

import io.github.drompincen.crewflow.protocol.api.ThinkTrigger;

/**
 * Payload of {@link EventNames#THINK}. {@code hop} counts how many message-driven wake-ups
 * preceded this one in the same chain; scheduled and manual triggers start at zero.
 */
public record ThinkAgentPayload(
        String agentId,
        String projectId,
        ThinkTrigger trigger,
        int hop
) {
    public static ThinkAgentPayload of(String agentId, String projectId, ThinkTrigger trigger) {
        return new ThinkAgentPayload(agentId, projectId, trigger, 0);
    }

    public ThinkAgentPayload wakeUp(String recipientId) {
        return new ThinkAgentPayload(recipientId, projectId, ThinkTrigger.MESSAGE_RECEIVED, hop + 1);
    }
}
