package io.github.drompincen.crewflow.runtime.agent;

@FunctionalInterface
public interface AgentBehavior {

    ThinkResult think(ThinkContext context);
}
