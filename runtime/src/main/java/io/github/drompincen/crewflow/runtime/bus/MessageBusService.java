package io.github.drompincen.crewflow.runtime.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.persistence.document.AgentMessageDocument;
import io.github.drompincen.crewflow.persistence.document.DecisionDocument;
import io.github.drompincen.crewflow.persistence.repository.AgentMessageRepository;
import io.github.drompincen.crewflow.persistence.repository.AgentRepository;
import io.github.drompincen.crewflow.persistence.repository.DecisionRepository;
import io.github.drompincen.crewflow.protocol.api.DecisionStatus;
import io.github.drompincen.crewflow.runtime.agent.AgentAction;
import io.github.drompincen.crewflow.runtime.agent.ThinkResult;
import io.github.drompincen.crewflow.runtime.config.AgentCycleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persists what agents say and propose, tracks which messages they have read, and expires old
 * messages.
 */
@Service
public class MessageBusService {

    private static final Logger log = LoggerFactory.getLogger(MessageBusService.class);

    private final AgentRepository agentRepository;
    private final AgentMessageRepository messageRepository;
    private final DecisionRepository decisionRepository;
    private final AgentCycleProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MessageBusService(AgentRepository agentRepository,
                             AgentMessageRepository messageRepository,
                             DecisionRepository decisionRepository,
                             AgentCycleProperties properties,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.agentRepository = agentRepository;
        this.messageRepository = messageRepository;
        this.decisionRepository = decisionRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Writes the messages and decisions in {@code result}. Ids are {@code idPrefix:m<i>} and
     * {@code idPrefix:d<i>} for action index {@code i}, so processing the same result again
     * overwrites instead of duplicating. Returned recipients keep action order and may repeat.
     */
    public ProcessedResult processThinkResult(AgentDocument agent, ThinkResult result, String idPrefix) {
        Instant now = clock.instant();
        List<String> messageIds = new ArrayList<>();
        List<String> decisionIds = new ArrayList<>();
        List<String> recipients = new ArrayList<>();

        List<AgentAction> actions = result.actions();
        for (int i = 0; i < actions.size(); i++) {
            AgentAction action = actions.get(i);
            if (action instanceof AgentAction.SendMessageAction send) {
                String id = idPrefix + ":m" + i;
                if (send.toAgentId() != null && !isRecipientInProject(send.toAgentId(), agent.getProjectId())) {
                    log.warn("Dropping message from {} to {}: recipient is not an agent of project {}",
                            agent.getAgentId(), send.toAgentId(), agent.getProjectId());
                    continue;
                }
                messageRepository.save(toMessage(id, agent, send, now));
                messageIds.add(id);
                if (send.toAgentId() != null) recipients.add(send.toAgentId());
            } else if (action instanceof AgentAction.ProposeDecisionAction propose) {
                String id = idPrefix + ":d" + i;
                decisionRepository.save(toDecision(id, agent, propose, now));
                decisionIds.add(id);
            }
        }

        log.debug("Agent {} produced {} message(s), {} decision(s)", agent.getAgentId(), messageIds.size(), decisionIds.size());
        return new ProcessedResult(messageIds, decisionIds, recipients);
    }

    /**
     * Marks the messages an agent was shown as read, so its next context leaves them out.
     */
    public long acknowledge(String agentId, List<String> messageIds) {
        if (messageIds.isEmpty()) return 0;
        long changed = messageRepository.acknowledge(agentId, messageIds, clock.instant());
        log.debug("Agent {} acknowledged {} of {} message(s)", agentId, changed, messageIds.size());
        return changed;
    }

    /**
     * Deletes the project's messages created before {@code now - ttl}.
     */
    public long expireOldMessages(String projectId, Duration ttl) {
        Instant cutoff = clock.instant().minus(ttl);
        long deleted = messageRepository.deleteByProjectIdAndCreatedAtBefore(projectId, cutoff);
        if (deleted > 0) {
            log.info("Expired {} message(s) of project {} older than {}", deleted, projectId, cutoff);
        }
        return deleted;
    }

    public long expireOldMessages(String projectId) {
        return expireOldMessages(projectId, properties.getMessageTtl());
    }

    private boolean isRecipientInProject(String agentId, String projectId) {
        Optional<AgentDocument> recipient = agentRepository.findById(agentId);
        return recipient.isPresent() && projectId.equals(recipient.get().getProjectId());
    }

    private AgentMessageDocument toMessage(String id, AgentDocument agent, AgentAction.SendMessageAction send, Instant now) {
        AgentMessageDocument msg = new AgentMessageDocument();
        msg.setMessageId(id);
        msg.setProjectId(agent.getProjectId());
        msg.setFromAgentId(agent.getAgentId());
        msg.setToAgentId(send.toAgentId());
        msg.setMessageType(send.messageType());
        msg.setSubject(send.subject());
        msg.setPayload(toStorable(send.payload()));
        msg.setPriority(send.priority());
        msg.setThreadId(send.threadId() != null ? send.threadId() : id);
        msg.setCreatedAt(now);
        msg.setExpiresAt(now.plus(properties.getMessageTtl()));
        return msg;
    }

    private DecisionDocument toDecision(String id, AgentDocument agent, AgentAction.ProposeDecisionAction propose, Instant now) {
        DecisionDocument decision = new DecisionDocument();
        decision.setDecisionId(id);
        decision.setAgentId(agent.getAgentId());
        decision.setProjectId(agent.getProjectId());
        decision.setKind(propose.decisionKind());
        decision.setStatus(DecisionStatus.PENDING);
        decision.setTitle(propose.title());
        decision.setDescription(propose.description());
        decision.setReasoning(propose.reasoning());
        decision.setConfidence(propose.confidence());
        decision.setPayload(toStorable(propose.payload()));
        decision.setThreadId(propose.threadId());
        decision.setCreatedAt(now);
        return decision;
    }

    /** Plain maps, lists and scalars, which the Mongo converter stores as-is. */
    private Object toStorable(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) return null;
        return objectMapper.convertValue(payload, Object.class);
    }

    public record ProcessedResult(List<String> messageIds, List<String> decisionIds, List<String> recipientAgentIds) {}
}
