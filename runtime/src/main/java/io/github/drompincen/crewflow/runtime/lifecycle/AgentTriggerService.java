package io.github.drompincen.crewflow.runtime.lifecycle;

import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.persistence.repository.AgentRepository;
import io.github.drompincen.crewflow.protocol.api.ThinkTrigger;
import io.github.drompincen.crewflow.protocol.event.EngineEvent;
import io.github.drompincen.crewflow.protocol.event.PlanningCyclePayload;
import io.github.drompincen.crewflow.protocol.event.ThinkAgentPayload;
import io.github.drompincen.crewflow.runtime.dispatch.EventDispatcher;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry points for on-demand runs.
 */
@Service
public class AgentTriggerService {

    private final AgentRepository agentRepository;
    private final EventDispatcher dispatcher;

    public AgentTriggerService(AgentRepository agentRepository, EventDispatcher dispatcher) {
        this.agentRepository = agentRepository;
        this.dispatcher = dispatcher;
    }

    public List<String> thinkNow(String agentId) {
        AgentDocument agent = agentRepository.findById(agentId)
                .orElseThrow(() -> new AgentNotFoundException(agentId));
        return dispatcher.send(EngineEvent.think(
                ThinkAgentPayload.of(agentId, agent.getProjectId(), ThinkTrigger.MANUAL)));
    }

    public List<String> startPlanningCycle(String projectId, String initiatedBy) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        return dispatcher.send(EngineEvent.planningCycle(new PlanningCyclePayload(projectId, initiatedBy)));
    }
}
