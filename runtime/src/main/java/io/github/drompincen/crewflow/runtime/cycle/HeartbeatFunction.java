package io.github.drompincen.crewflow.runtime.cycle;

import com.fasterxml.jackson.core.type.TypeReference;
import io.github.drompincen.crewflow.persistence.repository.AgentRepository;
import io.github.drompincen.crewflow.protocol.api.CycleStatus;
import io.github.drompincen.crewflow.protocol.api.HeartbeatResult;
import io.github.drompincen.crewflow.protocol.api.ThinkTrigger;
import io.github.drompincen.crewflow.protocol.event.EngineEvent;
import io.github.drompincen.crewflow.protocol.event.ThinkAgentPayload;
import io.github.drompincen.crewflow.runtime.config.AgentCycleProperties;
import io.github.drompincen.crewflow.runtime.dispatch.EngineFunction;
import io.github.drompincen.crewflow.runtime.dispatch.EventDispatcher;
import io.github.drompincen.crewflow.runtime.dispatch.FunctionConfig;
import io.github.drompincen.crewflow.runtime.dispatch.FunctionContext;
import io.github.drompincen.crewflow.runtime.dispatch.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Periodic sweep that claims agents whose last run is older than the heartbeat interval and
 * sends each one a scheduled think event.
 */
@Component
public class HeartbeatFunction implements EngineFunction<HeartbeatResult> {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatFunction.class);

    public static final String ID = "agent-heartbeat";
    static final int RETRIES = 1;

    private static final TypeReference<List<DueAgent>> DUE_AGENTS = new TypeReference<List<DueAgent>>() {};

    private final AgentRepository agentRepository;
    private final EventDispatcher dispatcher;
    private final AgentCycleProperties properties;
    private final Clock clock;
    private final FunctionConfig config;

    public HeartbeatFunction(AgentRepository agentRepository,
                             @Lazy EventDispatcher dispatcher,
                             AgentCycleProperties properties,
                             Clock clock) {
        this.agentRepository = agentRepository;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
        this.config = FunctionConfig.onCron(ID, "Agent heartbeat", properties.getHeartbeatCron(), RETRIES);
    }

    @Override
    public FunctionConfig config() {
        return config;
    }

    @Override
    public HeartbeatResult execute(FunctionContext ctx) {
        StepRunner step = ctx.step();

        List<DueAgent> due = step.run("find-due-agents", DUE_AGENTS, this::findDue);
        if (due.isEmpty()) {
            log.debug("Heartbeat: no agents due");
            return HeartbeatResult.noAgentsDue();
        }

        List<DueAgent> claimed = step.run("claim-due-agents", DUE_AGENTS, () -> claim(due));

        Integer dispatched = step.run("trigger-agents", Integer.class, () -> {
            if (claimed.isEmpty()) return 0;
            List<EngineEvent> events = claimed.stream()
                    .map(a -> EngineEvent.think(ThinkAgentPayload.of(a.agentId(), a.projectId(), ThinkTrigger.SCHEDULED)))
                    .toList();
            try {
                dispatcher.sendBatch(events);
            } catch (RuntimeException e) {
                reportUntriggered(ctx, claimed, e);
                throw e;
            }
            return events.size();
        });

        log.info("Heartbeat: {} agent(s) due, {} claimed, {} triggered", due.size(), claimed.size(), dispatched);
        return new HeartbeatResult(CycleStatus.TRIGGERED, due.size(), dispatched);
    }

    /** Claimed agents already carry a fresh lastRunAt, so the next sweeps will not pick them up. */
    private void reportUntriggered(FunctionContext ctx, List<DueAgent> claimed, RuntimeException e) {
        List<String> ids = claimed.stream().map(DueAgent::agentId).toList();
        if (ctx.attempt() >= config.maxAttempts()) {
            log.warn("Heartbeat gave up triggering claimed agents {} after {} attempt(s), they wait for the "
                    + "next interval: {}", ids, ctx.attempt(), e.getMessage());
        } else {
            log.warn("Heartbeat could not trigger claimed agents {} on attempt {}, retrying: {}",
                    ids, ctx.attempt(), e.getMessage());
        }
    }

    List<DueAgent> findDue() {
        Instant cutoff = clock.instant().minus(properties.getHeartbeatInterval());
        return agentRepository.findDueAgents(cutoff, properties.getHeartbeatBatchSize()).stream()
                .map(a -> new DueAgent(a.getAgentId(), a.getProjectId(), a.getLastRunAt()))
                .toList();
    }

    List<DueAgent> claim(List<DueAgent> due) {
        Instant now = clock.instant();
        List<DueAgent> claimed = new ArrayList<>();
        for (DueAgent agent : due) {
            if (agentRepository.claimDueRun(agent.agentId(), agent.lastRunAt(), now)) {
                claimed.add(agent);
            } else {
                log.debug("Agent {} was claimed by a concurrent sweep", agent.agentId());
            }
        }
        return claimed;
    }

    public record DueAgent(String agentId, String projectId, Instant lastRunAt) {}
}
