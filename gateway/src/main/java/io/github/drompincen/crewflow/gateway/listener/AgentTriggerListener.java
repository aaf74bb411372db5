package io.github.drompincen.crewflow.gateway.listener;

import io.github.drompincen.crewflow.protocol.event.PlanningRequested;
import io.github.drompincen.crewflow.protocol.event.ThinkRequested;
import io.github.drompincen.crewflow.runtime.lifecycle.AgentNotFoundException;
import io.github.drompincen.crewflow.runtime.lifecycle.AgentTriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns in-process application events into dispatcher runs.
 */
@Component
public class AgentTriggerListener {

    private static final Logger log = LoggerFactory.getLogger(AgentTriggerListener.class);

    private final AgentTriggerService triggerService;

    public AgentTriggerListener(AgentTriggerService triggerService) {
        this.triggerService = triggerService;
    }

    @EventListener
    public void onThinkRequested(ThinkRequested event) {
        try {
            List<String> runIds = triggerService.thinkNow(event.agentId());
            log.info("Think requested for agent {}: runs {}", event.agentId(), runIds);
        } catch (AgentNotFoundException e) {
            log.warn("Ignoring think request: {}", e.getMessage());
        }
    }

    @EventListener
    public void onPlanningRequested(PlanningRequested event) {
        List<String> runIds = triggerService.startPlanningCycle(event.projectId(), event.initiatedBy());
        log.info("Planning cycle requested for project {} by {}: runs {}", event.projectId(),
                event.initiatedBy(), runIds);
    }
}
