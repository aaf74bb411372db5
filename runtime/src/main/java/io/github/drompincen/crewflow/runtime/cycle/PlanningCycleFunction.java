package io.github.drompincen.crewflow.runtime.cycle;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.persistence.repository.AgentRepository;
import io.github.drompincen.crewflow.protocol.api.AgentStatus;
import io.github.drompincen.crewflow.protocol.api.AgentTurnSummary;
import io.github.drompincen.crewflow.protocol.api.AgentType;
import io.github.drompincen.crewflow.protocol.api.CycleStatus;
import io.github.drompincen.crewflow.protocol.api.PlanningCycleResult;
import io.github.drompincen.crewflow.protocol.event.EventNames;
import io.github.drompincen.crewflow.runtime.agent.BehaviorRegistry;
import io.github.drompincen.crewflow.runtime.agent.ThinkContext;
import io.github.drompincen.crewflow.runtime.agent.ThinkResult;
import io.github.drompincen.crewflow.runtime.bus.MessageBusService;
import io.github.drompincen.crewflow.runtime.bus.MessageBusService.ProcessedResult;
import io.github.drompincen.crewflow.runtime.config.AgentCycleProperties;
import io.github.drompincen.crewflow.runtime.context.ContextBuilder;
import io.github.drompincen.crewflow.runtime.dispatch.EngineFunction;
import io.github.drompincen.crewflow.runtime.dispatch.FunctionConfig;
import io.github.drompincen.crewflow.runtime.dispatch.FunctionContext;
import io.github.drompincen.crewflow.runtime.dispatch.MalformedTriggerException;
import io.github.drompincen.crewflow.runtime.dispatch.StepRunner;
import io.github.drompincen.crewflow.runtime.dispatch.Throttle;
import io.github.drompincen.crewflow.runtime.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Project-wide round: expire old messages, then optimizer, manager and each developer think in
 * that order. Each turn is its own step, so later agents see what earlier ones wrote. Agents
 * are not woken by messages sent here.
 */
@Component
public class PlanningCycleFunction implements EngineFunction<PlanningCycleResult> {

    private static final Logger log = LoggerFactory.getLogger(PlanningCycleFunction.class);

    public static final String ID = "planning-cycle";
    static final int RETRIES = 1;

    private final AgentRepository agentRepository;
    private final ContextBuilder contextBuilder;
    private final BehaviorRegistry behaviorRegistry;
    private final MessageBusService messageBus;
    private final FunctionConfig config;

    public PlanningCycleFunction(AgentRepository agentRepository,
                                 ContextBuilder contextBuilder,
                                 BehaviorRegistry behaviorRegistry,
                                 MessageBusService messageBus,
                                 AgentCycleProperties properties) {
        this.agentRepository = agentRepository;
        this.contextBuilder = contextBuilder;
        this.behaviorRegistry = behaviorRegistry;
        this.messageBus = messageBus;
        this.config = FunctionConfig.onEvent(ID, "Project planning cycle", EventNames.PLANNING_CYCLE, RETRIES,
                new Throttle("projectId", 1, properties.getPlanningThrottle()));
    }

    @Override
    public FunctionConfig config() {
        return config;
    }

    @Override
    public PlanningCycleResult execute(FunctionContext ctx) {
        String projectId = projectId(ctx.event().data());
        MdcContext.setProject(projectId);
        StepRunner step = ctx.step();

        Long expired = step.run("cleanup", Long.class, () -> messageBus.expireOldMessages(projectId));

        Roster roster = step.run("load-roster", Roster.class, () -> loadRoster(projectId));

        boolean optimizerRan = roster.optimizerId() != null
                && turn(step, "run-optimizer", roster.optimizerId(), ctx.runId()) != null;
        boolean managerRan = roster.managerId() != null
                && turn(step, "run-manager", roster.managerId(), ctx.runId()) != null;

        int developersRan = 0;
        for (String developerId : roster.developerIds()) {
            if (turn(step, "run-dev-" + developerId, developerId, ctx.runId()) != null) {
                developersRan++;
            }
        }

        log.info("Planning cycle for project {}: {} message(s) expired, {} agent(s), optimizer={}, manager={}, developers={}",
                projectId, expired, roster.agentCount(), optimizerRan, managerRan, developersRan);
        return new PlanningCycleResult(CycleStatus.COMPLETED, expired, roster.agentCount(),
                optimizerRan, managerRan, developersRan);
    }

    Roster loadRoster(String projectId) {
        List<AgentDocument> agents = agentRepository.findByProjectIdAndStatusOrderByCreatedAtAsc(projectId, AgentStatus.ACTIVE);
        String optimizerId = null;
        String managerId = null;
        List<String> developers = new ArrayList<>();
        for (AgentDocument agent : agents) {
            if (agent.getAgentType() == AgentType.OPTIMIZER && optimizerId == null) {
                optimizerId = agent.getAgentId();
            } else if (agent.getAgentType() == AgentType.MANAGER && managerId == null) {
                managerId = agent.getAgentId();
            } else if (agent.getAgentType() == AgentType.DEVELOPER) {
                developers.add(agent.getAgentId());
            }
        }
        return new Roster(optimizerId, managerId, developers, agents.size());
    }

    /** Returns null when the agent is no longer active. */
    private AgentTurnSummary turn(StepRunner step, String stepName, String agentId, String runId) {
        return step.run(stepName, AgentTurnSummary.class, () -> {
            AgentDocument agent = agentRepository.findById(agentId).orElse(null);
            if (agent == null || !agent.isActive()) {
                log.info("Planning turn {} skipped: agent {} is no longer active", stepName, agentId);
                return null;
            }
            ThinkContext context = contextBuilder.build(agentId);
            ThinkResult result = behaviorRegistry.behaviorFor(agent.getAgentType()).think(context);
            ProcessedResult processed = messageBus.processThinkResult(agent, result, runId + ":" + stepName);
            messageBus.acknowledge(agentId, context.pendingMessageIds());
            return new AgentTurnSummary(agentId, agent.getOwnerId(), result.actions().size(),
                    processed.messageIds().size(), processed.decisionIds().size());
        });
    }

    private static String projectId(JsonNode data) {
        if (data == null || !data.hasNonNull("projectId") || data.get("projectId").asText().isBlank()) {
            throw new MalformedTriggerException(EventNames.PLANNING_CYCLE + " requires projectId");
        }
        return data.get("projectId").asText();
    }

    public record Roster(String optimizerId, String managerId, List<String> developerIds, int agentCount) {}
}
