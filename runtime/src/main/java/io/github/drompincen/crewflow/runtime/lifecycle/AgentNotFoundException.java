package io.github.drompincen.crewflow.runtime.lifecycle;

public class AgentNotFoundException extends RuntimeException {

    public AgentNotFoundException(String agentId) {
        super("Agent not found: " + agentId);
    }
}
