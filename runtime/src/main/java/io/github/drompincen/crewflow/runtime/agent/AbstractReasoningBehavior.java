package io.github.drompincen.crewflow.runtime.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.protocol.api.DecisionKind;
import io.github.drompincen.crewflow.protocol.api.MessageType;
import io.github.drompincen.crewflow.runtime.agent.llm.ReasoningClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Prompt, call, parse, validate. Subclasses contribute the system prompt and a role-specific
 * analysis section.
 */
public abstract class AbstractReasoningBehavior implements AgentBehavior {

    private static final Logger log = LoggerFactory.getLogger(AbstractReasoningBehavior.class);
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    protected final ReasoningClient reasoningClient;
    protected final ObjectMapper objectMapper;

    protected AbstractReasoningBehavior(ReasoningClient reasoningClient, ObjectMapper objectMapper) {
        this.reasoningClient = reasoningClient;
        this.objectMapper = objectMapper;
    }

    protected abstract String role();

    protected abstract String systemPrompt();

    /** Extra prompt section for this role, or an empty string. */
    protected abstract String roleContext(ThinkContext context);

    @Override
    public ThinkResult think(ThinkContext context) {
        String text = reasoningClient.complete(systemPrompt(), buildPrompt(context));
        ThinkResult parsed = parseResponse(text);
        List<AgentAction> valid = validateActions(parsed.actions(), context);
        if (valid.size() < parsed.actions().size()) {
            log.info("{} agent {}: dropped {} invalid action(s)", role(), context.agentId(),
                    parsed.actions().size() - valid.size());
        }
        return new ThinkResult(parsed.reasoning(), valid);
    }

    protected List<AgentAction> validateActions(List<AgentAction> actions, ThinkContext context) {
        List<AgentAction> valid = new ArrayList<>();
        for (AgentAction action : actions) {
            if (action instanceof AgentAction.ProposeDecisionAction decision) {
                if (decision.decisionKind() == null) continue;
                if (decision.confidence() < 0 || decision.confidence() > 1) continue;
                if (isBlank(decision.title()) || isBlank(decision.reasoning())) continue;
            } else if (action instanceof AgentAction.SendMessageAction message) {
                if (message.messageType() == null || isBlank(message.subject())) continue;
                if (message.toAgentId() != null && !context.hasTeammate(message.toAgentId())) continue;
            }
            valid.add(action);
        }
        return valid;
    }

    String buildPrompt(ThinkContext context) {
        List<String> sections = new ArrayList<>();

        sections.add("## Your Identity\n"
                + "You are the " + role() + " agent for owner " + context.ownerId()
                + " on project " + context.projectId() + ".\n"
                + "Your agent id: " + context.agentId() + "\n"
                + "Your trust score: " + Math.round(context.trustScore() * 100) + "%");

        JsonNode snapshot = context.projectSnapshot();
        if (snapshot != null && !snapshot.isEmpty()) {
            sections.add("## Project Status\n" + snapshot.toPrettyString());
        }

        sections.add("## Team\n" + (context.teammates().isEmpty()
                ? "No other agents on this project."
                : context.teammates().stream()
                        .map(t -> "- " + t.agentId() + ": " + t.agentType() + " agent of " + t.ownerId())
                        .collect(Collectors.joining("\n"))));

        if (!context.pendingMessages().isEmpty()) {
            sections.add("## Incoming Messages (unread)\n" + context.pendingMessages().stream()
                    .map(m -> "- [" + m.messageType() + "] from " + m.fromAgentId()
                            + (m.toAgentId() == null ? " (broadcast)" : "")
                            + " (priority " + m.priority() + "): \"" + m.subject() + "\"\n"
                            + "  Payload: " + (m.payload() == null ? "{}" : m.payload().toString()))
                    .collect(Collectors.joining("\n\n")));
        }

        if (!context.recentDecisions().isEmpty()) {
            sections.add("## Recent Decisions\n" + context.recentDecisions().stream()
                    .map(d -> "- [" + d.status() + "] " + d.kind() + ": \"" + d.title()
                            + "\" (confidence: " + Math.round(d.confidence() * 100) + "%)")
                    .collect(Collectors.joining("\n")));
        }

        String roleSection = roleContext(context);
        if (!isBlank(roleSection)) sections.add(roleSection);

        sections.add(RESPONSE_FORMAT);
        return String.join("\n\n", sections);
    }

    ThinkResult parseResponse(String text) {
        if (text == null) text = "";
        Matcher matcher = JSON_OBJECT.matcher(text);
        if (!matcher.find()) {
            return ThinkResult.noAction(text, "Failed to parse reasoning response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            log.debug("Reasoning response is not valid JSON: {}", e.getOriginalMessage());
            return ThinkResult.noAction(text, "JSON parse error in reasoning response");
        }

        String reasoning = textOr(root, "reasoning", text);
        List<AgentAction> actions = new ArrayList<>();
        for (JsonNode a : root.path("actions")) {
            String kind = a.path("kind").asText("");
            if ("send_message".equals(kind)) {
                actions.add(new AgentAction.SendMessageAction(
                        textOr(a, "toAgentId", null),
                        a.hasNonNull("messageType")
                                ? parseEnum(MessageType.class, a.get("messageType").asText())
                                : MessageType.STATUS_UPDATE,
                        textOr(a, "subject", "Update"),
                        a.hasNonNull("payload") ? a.get("payload") : objectMapper.createObjectNode(),
                        a.path("priority").isNumber() ? a.get("priority").asInt() : 5,
                        textOr(a, "threadId", null)));
            } else if ("propose_decision".equals(kind)) {
                JsonNode payload = a.hasNonNull("actionPayload") ? a.get("actionPayload") : a.get("payload");
                actions.add(new AgentAction.ProposeDecisionAction(
                        a.hasNonNull("decisionType")
                                ? parseEnum(DecisionKind.class, a.get("decisionType").asText())
                                : DecisionKind.WORKLOAD_REBALANCE,
                        textOr(a, "title", "Decision"),
                        textOr(a, "description", ""),
                        textOr(a, "reasoning", textOr(root, "reasoning", "")),
                        a.path("confidence").isNumber() ? a.get("confidence").asDouble() : 0.5,
                        payload != null && !payload.isNull() ? payload : objectMapper.createObjectNode(),
                        textOr(a, "threadId", null)));
            } else {
                actions.add(new AgentAction.NoAction(textOr(a, "reason", "No action needed")));
            }
        }
        return new ThinkResult(reasoning, actions);
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        return node.hasNonNull(field) ? node.get(field).asText() : fallback;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    protected static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static final String RESPONSE_FORMAT = """
            ## Response Format
            Respond with a JSON object with these fields:
            {
              "reasoning": "Your thinking process...",
              "actions": [
                {
                  "kind": "send_message",
                  "toAgentId": "agent-id or null for broadcast",
                  "messageType": "HELP_REQUEST|TASK_OFFER|NEGOTIATION_PROPOSAL|STATUS_UPDATE|ALERT|BROADCAST",
                  "subject": "Brief subject line",
                  "payload": { },
                  "priority": 5
                },
                {
                  "kind": "propose_decision",
                  "decisionType": "TASK_REASSIGNMENT|DEADLINE_EXTENSION|HELP_REQUEST|WORKLOAD_REBALANCE|BLOCKER_ESCALATION|REVIEW_ASSIGNMENT|SPRINT_REPLANNING|BURNOUT_ALERT",
                  "title": "Short title",
                  "description": "What should happen",
                  "reasoning": "Why this is the right call",
                  "confidence": 0.8,
                  "actionPayload": { }
                },
                {
                  "kind": "no_action",
                  "reason": "Everything looks good right now"
                }
              ]
            }

            RULES:
            - Only message agents listed under Team, or broadcast with a null toAgentId.
            - Only propose decisions you are confident about (confidence above 0.6).
            - If you have pending messages, respond to them first.
            - Keep actions to 1-3 per cycle.""";
}
