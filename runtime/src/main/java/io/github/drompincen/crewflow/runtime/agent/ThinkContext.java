package io.github.drompincen.crewflow.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.crewflow.protocol.api.AgentType;
import io.github.drompincen.crewflow.protocol.api.DecisionKind;
import io.github.drompincen.crewflow.protocol.api.DecisionStatus;
import io.github.drompincen.crewflow.protocol.api.MessageType;

import java.time.Instant;
import java.util.List;

/**
 * Everything an agent sees in one think cycle. Rebuilt for every cycle, never stored except as
 * a step checkpoint.
 */
public record ThinkContext(
        String agentId,
        AgentType agentType,
        String ownerId,
        String projectId,
        double trustScore,
        List<Teammate> teammates,
        JsonNode projectSnapshot,
        List<PendingMessage> pendingMessages,
        List<RecentDecision> recentDecisions,
        Instant builtAt
) {
    public ThinkContext {
        teammates = teammates == null ? List.of() : List.copyOf(teammates);
        pendingMessages = pendingMessages == null ? List.of() : List.copyOf(pendingMessages);
        recentDecisions = recentDecisions == null ? List.of() : List.copyOf(recentDecisions);
    }

    public boolean hasTeammate(String agentId) {
        return teammates.stream().anyMatch(t -> t.agentId().equals(agentId));
    }

    public List<String> pendingMessageIds() {
        return pendingMessages.stream().map(PendingMessage::messageId).toList();
    }

    public record Teammate(String agentId, AgentType agentType, String ownerId) {}

    public record PendingMessage(
            String messageId,
            String fromAgentId,
            String toAgentId,
            MessageType messageType,
            String subject,
            JsonNode payload,
            int priority,
            String threadId,
            Instant createdAt
    ) {}

    public record RecentDecision(
            String decisionId,
            DecisionKind kind,
            DecisionStatus status,
            String title,
            double confidence,
            Instant createdAt
    ) {}
}
