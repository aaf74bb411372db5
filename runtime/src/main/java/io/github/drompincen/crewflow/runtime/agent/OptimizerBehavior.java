package io.github.drompincen.crewflow.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.protocol.api.DecisionStatus;
import io.github.drompincen.crewflow.runtime.agent.llm.ReasoningClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Component
public class OptimizerBehavior extends AbstractReasoningBehavior {

    private static final String SYSTEM_PROMPT = """
            You are an Optimizer Agent in a multi-agent project management system.
            You analyze the entire project from a systems-optimization perspective:
            workload distribution, critical path, bottlenecks and schedule feasibility.
            Think in terms of team throughput and utilization, not individual task completion.
            Use numbers to justify every recommendation and learn from which of your past
            recommendations were accepted or rejected.
            Always respond with valid JSON.""";

    public OptimizerBehavior(ReasoningClient reasoningClient, ObjectMapper objectMapper) {
        super(reasoningClient, objectMapper);
    }

    @Override
    protected String role() {
        return "Optimizer";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String roleContext(ThinkContext context) {
        List<String> sections = new ArrayList<>();
        sections.add("## Optimizer Analysis");

        double[] utilizations = utilizations(context.projectSnapshot());
        if (utilizations.length > 0) {
            double avg = Arrays.stream(utilizations).average().orElse(0);
            double stdDev = Math.sqrt(Arrays.stream(utilizations).map(u -> (u - avg) * (u - avg)).average().orElse(0));
            double gini = gini(utilizations);
            sections.add(String.format("### Workload Distribution%n"
                            + "- Average utilization: %.0f%%%n"
                            + "- Std deviation: %.0f%%%s%n"
                            + "- Gini coefficient: %.2f %s",
                    avg, stdDev, stdDev > 30 ? " (HIGH VARIANCE, rebalancing recommended)" : "",
                    gini, gini > 0.3 ? "(unequal)" : "(balanced)"));
        }

        if (!context.recentDecisions().isEmpty()) {
            long accepted = context.recentDecisions().stream().filter(d -> d.status().countsAsAccepted()).count();
            long rejected = context.recentDecisions().stream().filter(d -> d.status() == DecisionStatus.REJECTED).count();
            int total = context.recentDecisions().size();
            sections.add(String.format("### Decision Track Record%n"
                            + "- Total: %d, Accepted: %d, Rejected: %d%n"
                            + "- Acceptance rate: %.0f%%",
                    total, accepted, rejected, accepted * 100.0 / total));
        }
        return String.join("\n\n", sections);
    }

    static double[] utilizations(JsonNode snapshot) {
        if (snapshot == null) return new double[0];
        List<Double> values = new ArrayList<>();
        for (JsonNode member : snapshot.path("teamCapacity")) {
            if (member.path("utilization").isNumber()) values.add(member.get("utilization").asDouble());
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /** 0 when perfectly even, approaching 1 when one member carries everything. */
    static double gini(double[] values) {
        if (values.length == 0) return 0;
        double mean = Arrays.stream(values).average().orElse(0);
        if (mean == 0) return 0;
        double sumDiffs = 0;
        for (double a : values) {
            for (double b : values) {
                sumDiffs += Math.abs(a - b);
            }
        }
        int n = values.length;
        return sumDiffs / (2.0 * n * n * mean);
    }
}
