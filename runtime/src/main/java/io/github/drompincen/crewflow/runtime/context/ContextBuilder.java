package io.github.drompincen.crewflow.runtime.context;

import io.github.drompincen.crewflow.runtime.agent.ThinkContext;

public interface ContextBuilder {

    ThinkContext build(String agentId);
}
