package io.github.drompincen.crewflow.persistence.repository;

import java.time.Instant;
import java.util.Collection;

public interface AgentMessageRepositoryCustom {

    /**
     * Marks {@code messageIds} as read by {@code agentId}. Direct messages addressed to the agent
     * become ACKNOWLEDGED; broadcasts record the agent as a reader and stay visible to the rest of
     * the project. Returns the number of documents changed.
     */
    long acknowledge(String agentId, Collection<String> messageIds, Instant readAt);
}
