package io.github.drompincen.crewflow.runtime.cycle;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.persistence.repository.AgentRepository;
import io.github.drompincen.crewflow.protocol.api.AgentStatus;
import io.github.drompincen.crewflow.protocol.api.AgentType;
import io.github.drompincen.crewflow.protocol.api.CycleStatus;
import io.github.drompincen.crewflow.protocol.api.FanOutOutcome;
import io.github.drompincen.crewflow.protocol.api.ThinkCycleResult;
import io.github.drompincen.crewflow.protocol.api.ThinkTrigger;
import io.github.drompincen.crewflow.protocol.event.EngineEvent;
import io.github.drompincen.crewflow.protocol.event.EventNames;
import io.github.drompincen.crewflow.protocol.event.ThinkAgentPayload;
import io.github.drompincen.crewflow.runtime.agent.BehaviorRegistry;
import io.github.drompincen.crewflow.runtime.agent.ThinkContext;
import io.github.drompincen.crewflow.runtime.agent.ThinkResult;
import io.github.drompincen.crewflow.runtime.bus.MessageBusService;
import io.github.drompincen.crewflow.runtime.bus.MessageBusService.ProcessedResult;
import io.github.drompincen.crewflow.runtime.config.AgentCycleProperties;
import io.github.drompincen.crewflow.runtime.context.ContextBuilder;
import io.github.drompincen.crewflow.runtime.dispatch.EngineFunction;
import io.github.drompincen.crewflow.runtime.dispatch.EventDispatcher;
import io.github.drompincen.crewflow.runtime.dispatch.FunctionConfig;
import io.github.drompincen.crewflow.runtime.dispatch.FunctionContext;
import io.github.drompincen.crewflow.runtime.dispatch.MalformedTriggerException;
import io.github.drompincen.crewflow.runtime.dispatch.StepRunner;
import io.github.drompincen.crewflow.runtime.dispatch.Throttle;
import io.github.drompincen.crewflow.runtime.lifecycle.AgentNotFoundException;
import io.github.drompincen.crewflow.runtime.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One agent's observe, reason, act turn, followed by waking the agents it messaged.
 */
@Component
public class ThinkCycleFunction implements EngineFunction<ThinkCycleResult> {

    private static final Logger log = LoggerFactory.getLogger(ThinkCycleFunction.class);

    public static final String ID = "agent-think";
    static final int RETRIES = 2;
    static final int REASONING_PREVIEW = 200;

    private final AgentRepository agentRepository;
    private final ContextBuilder contextBuilder;
    private final BehaviorRegistry behaviorRegistry;
    private final MessageBusService messageBus;
    private final EventDispatcher dispatcher;
    private final AgentCycleProperties properties;
    private final FunctionConfig config;

    public ThinkCycleFunction(AgentRepository agentRepository,
                              ContextBuilder contextBuilder,
                              BehaviorRegistry behaviorRegistry,
                              MessageBusService messageBus,
                              @Lazy EventDispatcher dispatcher,
                              AgentCycleProperties properties) {
        this.agentRepository = agentRepository;
        this.contextBuilder = contextBuilder;
        this.behaviorRegistry = behaviorRegistry;
        this.messageBus = messageBus;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.config = FunctionConfig.onEvent(ID, "Agent think cycle", EventNames.THINK, RETRIES,
                new Throttle("agentId", 1, properties.getThinkThrottle()));
    }

    @Override
    public FunctionConfig config() {
        return config;
    }

    @Override
    public ThinkCycleResult execute(FunctionContext ctx) {
        ThinkAgentPayload trigger = parsePayload(ctx.event().data());
        MdcContext.setAgent(trigger.agentId(), trigger.projectId());
        StepRunner step = ctx.step();

        LoadedAgent loaded = step.run("load-agent", LoadedAgent.class, () -> loadAgent(trigger));
        if (loaded.skipReason() != null) {
            log.info("Skipping think for agent {}: {}", trigger.agentId(), loaded.skipReason());
            return ThinkCycleResult.skipped(loaded.skipReason());
        }

        ThinkContext context = step.run("build-context", ThinkContext.class,
                () -> contextBuilder.build(trigger.agentId()));

        ThinkResult result = step.run("think", ThinkResult.class,
                () -> behaviorRegistry.behaviorFor(loaded.agentType()).think(context));

        ProcessedResult processed = step.run("process-results", ProcessedResult.class, () -> {
            AgentDocument agent = agentRepository.findById(trigger.agentId())
                    .orElseThrow(() -> new AgentNotFoundException(trigger.agentId()));
            ProcessedResult written = messageBus.processThinkResult(agent, result, ctx.runId());
            messageBus.acknowledge(trigger.agentId(), context.pendingMessageIds());
            return written;
        });

        FanOutOutcome fanOut = step.run("fan-out", FanOutOutcome.class,
                () -> fanOut(trigger, processed.recipientAgentIds()));

        log.info("Agent {} ({}) thought via {}: {} action(s), {} message(s), {} decision(s), fan-out {}",
                trigger.agentId(), loaded.agentType(), trigger.trigger().value(), result.actions().size(),
                processed.messageIds().size(), processed.decisionIds().size(), fanOut.status());

        return new ThinkCycleResult(CycleStatus.COMPLETED, null, loaded.agentType(), result.actions().size(),
                processed.messageIds(), processed.decisionIds(), fanOut, preview(result.reasoning()));
    }

    /** A merged wake-up keeps the deeper hop so the chain cannot restart its budget. */
    @Override
    public JsonNode coalesce(JsonNode queued, JsonNode incoming) {
        return incoming.path("hop").asInt(0) > queued.path("hop").asInt(0) ? incoming : queued;
    }

    LoadedAgent loadAgent(ThinkAgentPayload trigger) {
        Optional<AgentDocument> found = agentRepository.findById(trigger.agentId());
        if (found.isEmpty()) {
            return LoadedAgent.skip("agent-not-found");
        }
        AgentDocument agent = found.get();
        if (agent.getStatus() != AgentStatus.ACTIVE) {
            return LoadedAgent.skip("agent-" + agent.getStatus().name().toLowerCase(Locale.ROOT));
        }
        if (!trigger.projectId().equals(agent.getProjectId())) {
            return LoadedAgent.skip("project-mismatch");
        }
        return new LoadedAgent(agent.getAgentType(), null);
    }

    /**
     * Wakes each distinct recipient once. Send failures are reported, not thrown: the messages
     * are already committed and the recipients will see them on their next scheduled turn.
     */
    FanOutOutcome fanOut(ThinkAgentPayload trigger, List<String> recipients) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(recipients));
        if (distinct.isEmpty()) {
            return FanOutOutcome.none();
        }
        if (trigger.hop() + 1 > properties.getMaxFanOutHops()) {
            log.warn("Fan-out hop budget {} reached for agent {}, not waking {}",
                    properties.getMaxFanOutHops(), trigger.agentId(), distinct);
            return FanOutOutcome.hopLimit(distinct);
        }
        List<EngineEvent> events = distinct.stream()
                .map(recipient -> EngineEvent.think(trigger.wakeUp(recipient)))
                .toList();
        try {
            dispatcher.sendBatch(events);
            return FanOutOutcome.dispatched(distinct);
        } catch (RuntimeException e) {
            log.warn("Fan-out from agent {} to {} failed: {}", trigger.agentId(), distinct, e.getMessage());
            return FanOutOutcome.failed(distinct, e.getMessage());
        }
    }

    static ThinkAgentPayload parsePayload(JsonNode data) {
        String agentId = text(data, "agentId");
        String projectId = text(data, "projectId");
        if (agentId == null || projectId == null) {
            throw new MalformedTriggerException(EventNames.THINK + " requires agentId and projectId");
        }
        ThinkTrigger trigger;
        try {
            String raw = text(data, "trigger");
            trigger = raw == null ? ThinkTrigger.SCHEDULED : ThinkTrigger.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new MalformedTriggerException(e.getMessage());
        }
        int hop = data.path("hop").asInt(0);
        return new ThinkAgentPayload(agentId, projectId, trigger, Math.max(hop, 0));
    }

    private static String text(JsonNode data, String field) {
        if (data == null || !data.hasNonNull(field)) return null;
        String value = data.get(field).asText();
        return value.isBlank() ? null : value;
    }

    private static String preview(String reasoning) {
        if (reasoning == null) return null;
        return reasoning.length() <= REASONING_PREVIEW ? reasoning : reasoning.substring(0, REASONING_PREVIEW);
    }

    public record LoadedAgent(AgentType agentType, String skipReason) {

        static LoadedAgent skip(String reason) {
            return new LoadedAgent(null, reason);
        }
    }
}
