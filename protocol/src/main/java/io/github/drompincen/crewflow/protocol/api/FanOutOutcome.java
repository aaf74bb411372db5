package io.github.drompincen.crewflow.protocol.api;

import java.util.List;

public record FanOutOutcome(
        FanOutStatus status,
        List<String> wokenAgentIds,
        String error
) {
    public static FanOutOutcome none() {
        return new FanOutOutcome(FanOutStatus.NONE, List.of(), null);
    }

    public static FanOutOutcome dispatched(List<String> agentIds) {
        return new FanOutOutcome(FanOutStatus.DISPATCHED, List.copyOf(agentIds), null);
    }

    public static FanOutOutcome hopLimit(List<String> agentIds) {
        return new FanOutOutcome(FanOutStatus.HOP_LIMIT, List.copyOf(agentIds), null);
    }

    public static FanOutOutcome failed(List<String> agentIds, String error) {
        return new FanOutOutcome(FanOutStatus.FAILED, List.copyOf(agentIds), error);
    }
}
