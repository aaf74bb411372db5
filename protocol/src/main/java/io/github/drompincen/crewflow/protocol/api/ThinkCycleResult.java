package io.github.drompincen.crewflow.protocol.api;

import java.util.List;

/**
 * Result of one think cycle. {@code status} tells whether the agent's own messages and
 * decisions were committed; {@code fanOut} reports the best-effort wake-up dispatch separately.
 */
public record ThinkCycleResult(
        CycleStatus status,
        String reason,
        AgentType agentType,
        int actionsCount,
        List<String> messageIds,
        List<String> decisionIds,
        FanOutOutcome fanOut,
        String reasoning
) {
    public static ThinkCycleResult skipped(String reason) {
        return new ThinkCycleResult(CycleStatus.SKIPPED, reason, null, 0, List.of(), List.of(), FanOutOutcome.none(), null);
    }
}
