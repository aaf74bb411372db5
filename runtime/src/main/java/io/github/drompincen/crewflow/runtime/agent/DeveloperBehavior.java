package io.github.drompincen.crewflow.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.runtime.agent.llm.ReasoningClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class DeveloperBehavior extends AbstractReasoningBehavior {

    private static final String SYSTEM_PROMPT = """
            You are a Developer Agent in a multi-agent project management system.
            You represent one developer on the team. Flag unsustainable workload, reach out to
            other agents to remove blockers, offer help when you have spare capacity, and
            evaluate task swap proposals honestly.
            You can send STATUS_UPDATE, HELP_REQUEST, TASK_OFFER and NEGOTIATION_PROPOSAL messages
            and propose TASK_REASSIGNMENT or DEADLINE_EXTENSION decisions.
            Always respond with valid JSON.""";

    public DeveloperBehavior(ReasoningClient reasoningClient, ObjectMapper objectMapper) {
        super(reasoningClient, objectMapper);
    }

    @Override
    protected String role() {
        return "Developer";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String roleContext(ThinkContext context) {
        JsonNode snapshot = context.projectSnapshot();
        if (snapshot == null) return "";

        JsonNode mine = null;
        List<String> overloadedTeammates = new ArrayList<>();
        for (JsonNode member : snapshot.path("teamCapacity")) {
            if (context.ownerId() != null && context.ownerId().equals(member.path("userId").asText(null))) {
                mine = member;
            } else if (member.path("utilization").asDouble(0) > 110) {
                overloadedTeammates.add(member.path("userName").asText(member.path("userId").asText("?"))
                        + " (" + member.get("utilization").asInt() + "% utilized)");
            }
        }
        if (mine == null) return "";

        List<String> lines = new ArrayList<>();
        lines.add("## Developer-Specific Analysis");
        double utilization = mine.path("utilization").asDouble(0);
        if (utilization > 100) {
            lines.add("You are OVERLOADED at " + Math.round(utilization)
                    + "% utilization. Consider requesting help or proposing task reassignment.");
        } else if (utilization < 50) {
            lines.add("You have spare capacity (" + mine.path("availableHours").asInt(0)
                    + "h free). Look for teammates who need help.");
        }
        if (mine.path("burnoutRisk").asDouble(0) > 60) {
            lines.add("Burnout risk is " + mine.get("burnoutRisk").asInt() + "%. Prioritize reducing workload.");
        }
        if (!overloadedTeammates.isEmpty() && utilization < 80) {
            lines.add("Teammates who might need help: " + String.join(", ", overloadedTeammates));
        }
        return String.join("\n", lines);
    }
}
