package io.github.drompincen.crewflow.runtime.agent;

import io.github.drompincen.crewflow.protocol.api.AgentType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Closed mapping from agent type to behavior.
 */
@Component
public class BehaviorRegistry {

    private final AgentBehavior optimizer;
    private final AgentBehavior manager;
    private final AgentBehavior developer;

    @Autowired
    public BehaviorRegistry(OptimizerBehavior optimizer, ManagerBehavior manager, DeveloperBehavior developer) {
        this((AgentBehavior) optimizer, manager, developer);
    }

    public BehaviorRegistry(AgentBehavior optimizer, AgentBehavior manager, AgentBehavior developer) {
        this.optimizer = optimizer;
        this.manager = manager;
        this.developer = developer;
    }

    public AgentBehavior behaviorFor(AgentType type) {
        return switch (type) {
            case OPTIMIZER -> optimizer;
            case MANAGER -> manager;
            case DEVELOPER -> developer;
        };
    }
}
