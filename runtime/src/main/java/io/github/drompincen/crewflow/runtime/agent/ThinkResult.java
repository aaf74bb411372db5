package io.github.drompincen.crewflow.runtime.agent;

import java.util.List;

public record ThinkResult(String reasoning, List<AgentAction> actions) {

    public ThinkResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static ThinkResult noAction(String reasoning, String reason) {
        return new ThinkResult(reasoning, List.of(new AgentAction.NoAction(reason)));
    }
}
