package io.github.drompincen.crewflow.runtime.context;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.persistence.document.AgentMessageDocument;
import io.github.drompincen.crewflow.persistence.document.DecisionDocument;
import io.github.drompincen.crewflow.persistence.repository.AgentMessageRepository;
import io.github.drompincen.crewflow.persistence.repository.AgentRepository;
import io.github.drompincen.crewflow.persistence.repository.DecisionRepository;
import io.github.drompincen.crewflow.protocol.api.AgentStatus;
import io.github.drompincen.crewflow.protocol.api.MessageStatus;
import io.github.drompincen.crewflow.runtime.agent.ThinkContext;
import io.github.drompincen.crewflow.runtime.config.AgentCycleProperties;
import io.github.drompincen.crewflow.runtime.lifecycle.AgentNotFoundException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the agent's view of its project from the stores: unread messages, recent decisions,
 * teammates and the external project snapshot.
 */
@Service
public class DefaultContextBuilder implements ContextBuilder {

    private final AgentRepository agentRepository;
    private final AgentMessageRepository messageRepository;
    private final DecisionRepository decisionRepository;
    private final ProjectSnapshotProvider snapshotProvider;
    private final AgentCycleProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DefaultContextBuilder(AgentRepository agentRepository,
                                 AgentMessageRepository messageRepository,
                                 DecisionRepository decisionRepository,
                                 ProjectSnapshotProvider snapshotProvider,
                                 AgentCycleProperties properties,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.agentRepository = agentRepository;
        this.messageRepository = messageRepository;
        this.decisionRepository = decisionRepository;
        this.snapshotProvider = snapshotProvider;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ThinkContext build(String agentId) {
        AgentDocument agent = agentRepository.findById(agentId)
                .orElseThrow(() -> new AgentNotFoundException(agentId));
        String projectId = agent.getProjectId();
        Instant now = clock.instant();
        Instant since = now.minus(properties.getMessageTtl());

        List<AgentMessageDocument> inbox = new ArrayList<>(
                messageRepository.findByProjectIdAndToAgentIdAndStatusAndCreatedAtAfter(
                        projectId, agentId, MessageStatus.PENDING, since));
        messageRepository.findByProjectIdAndToAgentIdIsNullAndCreatedAtAfter(projectId, since).stream()
                .filter(m -> !agentId.equals(m.getFromAgentId()))
                .filter(m -> m.isUnreadBy(agentId))
                .forEach(inbox::add);

        List<ThinkContext.PendingMessage> pending = inbox.stream()
                .sorted(Comparator.comparingInt(AgentMessageDocument::getPriority)
                        .thenComparing(AgentMessageDocument::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(properties.getPendingMessageLimit())
                .map(this::toPending)
                .toList();

        List<ThinkContext.RecentDecision> decisions = decisionRepository
                .findByProjectIdAndAgentIdOrderByCreatedAtDesc(projectId, agentId,
                        PageRequest.of(0, properties.getRecentDecisionLimit()))
                .stream()
                .map(this::toRecent)
                .toList();

        List<ThinkContext.Teammate> teammates = agentRepository
                .findByProjectIdAndStatusOrderByCreatedAtAsc(projectId, AgentStatus.ACTIVE).stream()
                .filter(a -> !a.getAgentId().equals(agentId))
                .map(a -> new ThinkContext.Teammate(a.getAgentId(), a.getAgentType(), a.getOwnerId()))
                .toList();

        JsonNode snapshot = snapshotProvider.snapshot(projectId, agentId);

        return new ThinkContext(agentId, agent.getAgentType(), agent.getOwnerId(), projectId,
                agent.getTrustScore(), teammates,
                snapshot != null ? snapshot : objectMapper.createObjectNode(),
                pending, decisions, now);
    }

    private ThinkContext.PendingMessage toPending(AgentMessageDocument m) {
        JsonNode payload = m.getPayload() == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(m.getPayload());
        return new ThinkContext.PendingMessage(m.getMessageId(), m.getFromAgentId(), m.getToAgentId(),
                m.getMessageType(), m.getSubject(), payload, m.getPriority(), m.getThreadId(), m.getCreatedAt());
    }

    private ThinkContext.RecentDecision toRecent(DecisionDocument d) {
        return new ThinkContext.RecentDecision(d.getDecisionId(), d.getKind(), d.getStatus(), d.getTitle(),
                d.getConfidence(), d.getCreatedAt());
    }
}
