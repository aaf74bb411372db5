package io.github.drompincen.crewflow.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.protocol.api.MessageType;
import io.github.drompincen.crewflow.runtime.agent.llm.ReasoningClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ManagerBehavior extends AbstractReasoningBehavior {

    private static final String SYSTEM_PROMPT = """
            You are a Manager Agent in a multi-agent project management system.
            You oversee the project and coordinate between developer agents: watch delivery
            confidence, match HELP_REQUESTs with available teammates, prevent burnout, and
            propose replanning, reassignment or scope changes when the sprint is at risk.
            Prefer gentle interventions (messages to agents) before formal decisions.
            Always respond with valid JSON.""";

    public ManagerBehavior(ReasoningClient reasoningClient, ObjectMapper objectMapper) {
        super(reasoningClient, objectMapper);
    }

    @Override
    protected String role() {
        return "Manager";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String roleContext(ThinkContext context) {
        List<String> lines = new ArrayList<>();
        lines.add("## Manager-Specific Analysis");

        JsonNode snapshot = context.projectSnapshot();
        if (snapshot != null && snapshot.path("deliveryConfidence").isNumber()) {
            int confidence = snapshot.get("deliveryConfidence").asInt();
            if (confidence < 50) {
                lines.add("CRITICAL: delivery confidence is " + confidence + "%. Immediate intervention required.");
            } else if (confidence < 70) {
                lines.add("WARNING: delivery confidence is " + confidence + "%. Consider proactive rebalancing.");
            } else {
                lines.add("Delivery confidence: " + confidence + "%");
            }
        }

        List<String> overloaded = new ArrayList<>();
        List<String> burnout = new ArrayList<>();
        if (snapshot != null) {
            for (JsonNode member : snapshot.path("teamCapacity")) {
                String name = member.path("userName").asText(member.path("userId").asText("?"));
                if (member.path("utilization").asDouble(0) > 100) {
                    overloaded.add(name + " at " + member.get("utilization").asInt() + "%");
                }
                if (member.path("burnoutRisk").asDouble(0) > 60) {
                    burnout.add(name + " at " + member.get("burnoutRisk").asInt() + "%");
                }
            }
        }
        if (!overloaded.isEmpty()) lines.add("Overloaded members: " + String.join(", ", overloaded));
        if (!burnout.isEmpty()) lines.add("Burnout risk: " + String.join(", ", burnout));

        long helpRequests = context.pendingMessages().stream()
                .filter(m -> m.messageType() == MessageType.HELP_REQUEST)
                .count();
        if (helpRequests > 0) {
            lines.add(helpRequests + " open HELP_REQUEST message(s) waiting for a match.");
        }
        return String.join("\n", lines);
    }
}
