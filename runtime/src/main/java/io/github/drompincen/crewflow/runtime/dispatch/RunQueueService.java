package io.github.drompincen.crewflow.runtime.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.persistence.document.RunDocument;
import io.github.drompincen.crewflow.persistence.repository.RunRepository;
import io.github.drompincen.crewflow.protocol.api.RunStatus;
import io.github.drompincen.crewflow.protocol.event.EngineEvent;
import io.github.drompincen.crewflow.runtime.config.DispatcherProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable run queue: events become QUEUED runs, the poller claims due runs and hands them to the
 * worker pool.
 */
@Service
public class RunQueueService implements EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RunQueueService.class);

    private final RunRepository runRepository;
    private final FunctionRegistry functionRegistry;
    private final ThrottleService throttleService;
    private final RunExecutor runExecutor;
    private final TaskExecutor workerExecutor;
    private final DispatcherProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    public RunQueueService(RunRepository runRepository,
                           FunctionRegistry functionRegistry,
                           ThrottleService throttleService,
                           RunExecutor runExecutor,
                           @Qualifier("runWorkerExecutor") TaskExecutor workerExecutor,
                           DispatcherProperties properties,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.runRepository = runRepository;
        this.functionRegistry = functionRegistry;
        this.throttleService = throttleService;
        this.runExecutor = runExecutor;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public List<String> send(EngineEvent event) {
        List<EngineFunction<?>> functions = functionRegistry.forEvent(event.name());
        if (functions.isEmpty()) {
            log.warn("No function subscribed to event {}", event.name());
            return List.of();
        }
        List<String> runIds = new ArrayList<>();
        for (EngineFunction<?> function : functions) {
            runIds.add(enqueue(function, event));
        }
        return runIds;
    }

    @Override
    public List<String> sendBatch(List<EngineEvent> events) {
        List<String> runIds = new ArrayList<>();
        for (EngineEvent event : events) {
            runIds.addAll(send(event));
        }
        return runIds;
    }

    @Override
    public String invoke(String functionId) {
        return enqueue(functionRegistry.require(functionId), EngineEvent.cron(functionId));
    }

    String enqueue(EngineFunction<?> function, EngineEvent event) {
        FunctionConfig config = function.config();
        Instant now = clock.instant();
        String throttleKey = config.throttle() != null ? config.throttle().keyFor(event.data()) : null;

        if (throttleKey != null) {
            Optional<RunDocument> pending = runRepository.findFirstByFunctionIdAndThrottleKeyAndStatusAndStartedAtIsNull(
                    config.id(), throttleKey, RunStatus.QUEUED);
            if (pending.isPresent()) {
                RunDocument run = pending.get();
                run.setEventData(merge(function, run, event));
                run.setCoalescedEvents(run.getCoalescedEvents() + 1);
                run.setLastUpdatedAt(now);
                try {
                    runRepository.save(run);
                    log.debug("Merged event {} into queued run {} of {}", event.eventId(), run.getRunId(), config.id());
                    return run.getRunId();
                } catch (OptimisticLockingFailureException e) {
                    log.debug("Queued run {} was claimed meanwhile, queuing a new run", run.getRunId());
                }
            }
        }

        RunDocument run = new RunDocument();
        run.setRunId(UUID.randomUUID().toString());
        run.setFunctionId(config.id());
        run.setEventId(event.eventId());
        run.setEventName(event.name());
        run.setEventData(toJson(event));
        run.setThrottleKey(throttleKey);
        run.setStatus(RunStatus.QUEUED);
        run.setMaxAttempts(config.maxAttempts());
        run.setScheduledAt(now);
        run.setCreatedAt(now);
        run.setLastUpdatedAt(now);
        runRepository.save(run);
        log.debug("Queued run {} of {} for event {}", run.getRunId(), config.id(), event.name());
        return run.getRunId();
    }

    @Scheduled(fixedDelayString = "${crewflow.dispatcher.poll-interval-ms:1000}")
    public void pollAndExecute() {
        recoverStaleLeases();

        List<RunDocument> due = runRepository.findByStatusAndScheduledAtLessThanEqualOrderByScheduledAtAsc(
                RunStatus.QUEUED, clock.instant(), PageRequest.of(0, properties.getBatchSize()));

        for (RunDocument run : due) {
            Optional<RunDocument> claimed = claim(run);
            if (claimed.isEmpty()) continue;
            try {
                workerExecutor.execute(() -> runExecutor.execute(claimed.get()));
            } catch (TaskRejectedException e) {
                release(claimed.get());
                log.warn("Worker pool full, returned run {} to the queue and stopped this poll: {}",
                        claimed.get().getRunId(), e.getMessage());
                return;
            }
        }
    }

    /** Undoes a claim whose run never reached a worker. The attempt counter is untouched. */
    void release(RunDocument claimed) {
        claimed.setStatus(RunStatus.QUEUED);
        claimed.setLeaseOwner(null);
        claimed.setLeaseUntil(null);
        claimed.setLastUpdatedAt(clock.instant());
        saveQuietly(claimed);
    }

    Optional<RunDocument> claim(RunDocument run) {
        Optional<EngineFunction<?>> function = functionRegistry.find(run.getFunctionId());
        Instant now = clock.instant();
        if (function.isEmpty()) {
            run.setStatus(RunStatus.FAILED);
            run.setError("Unknown engine function: " + run.getFunctionId());
            run.setEndedAt(now);
            saveQuietly(run);
            log.warn("Dropped run {}: no function {}", run.getRunId(), run.getFunctionId());
            return Optional.empty();
        }

        run.setStatus(RunStatus.RUNNING);
        run.setLeaseOwner(instanceId);
        run.setLeaseUntil(now.plus(properties.getLeaseDuration()));
        run.setLastUpdatedAt(now);
        RunDocument claimed;
        try {
            claimed = runRepository.save(run);
        } catch (OptimisticLockingFailureException e) {
            log.debug("Run {} claimed by another worker", run.getRunId());
            return Optional.empty();
        }

        Throttle throttle = function.get().config().throttle();
        if (claimed.getAdmittedAt() == null && throttle != null && claimed.getThrottleKey() != null) {
            ThrottleService.ThrottleDecision decision =
                    throttleService.tryAcquire(claimed.getFunctionId(), claimed.getThrottleKey(), throttle, now);
            if (!decision.admitted()) {
                claimed.setStatus(RunStatus.QUEUED);
                claimed.setLeaseOwner(null);
                claimed.setLeaseUntil(null);
                claimed.setScheduledAt(decision.retryAt());
                saveQuietly(claimed);
                log.debug("Run {} of {} throttled on {}, deferred to {}", claimed.getRunId(),
                        claimed.getFunctionId(), claimed.getThrottleKey(), decision.retryAt());
                return Optional.empty();
            }
            claimed.setAdmittedAt(now);
        }

        log.debug("Claimed run {} of {}", claimed.getRunId(), claimed.getFunctionId());
        return Optional.of(claimed);
    }

    void recoverStaleLeases() {
        Instant threshold = clock.instant().minus(properties.getStaleLeaseGrace());
        List<RunDocument> stale = runRepository.findByStatusAndLeaseUntilLessThan(RunStatus.RUNNING, threshold);
        for (RunDocument run : stale) {
            log.info("Recovering run {} of {} with expired lease (owner {})", run.getRunId(),
                    run.getFunctionId(), run.getLeaseOwner());
            runExecutor.handleFailure(run, "Lease expired while running");
        }
    }

    private void saveQuietly(RunDocument run) {
        try {
            runRepository.save(run);
        } catch (OptimisticLockingFailureException e) {
            log.debug("Run {} changed concurrently: {}", run.getRunId(), e.getMessage());
        }
    }

    private String merge(EngineFunction<?> function, RunDocument run, EngineEvent event) {
        try {
            JsonNode queued = run.getEventData() == null
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(run.getEventData());
            JsonNode incoming = event.data() == null ? objectMapper.createObjectNode() : event.data();
            return objectMapper.writeValueAsString(function.coalesce(queued, incoming));
        } catch (JsonProcessingException e) {
            log.warn("Could not merge event {} into run {}, keeping queued data: {}", event.eventId(),
                    run.getRunId(), e.getOriginalMessage());
            return run.getEventData();
        }
    }

    private String toJson(EngineEvent event) {
        try {
            return objectMapper.writeValueAsString(event.data());
        } catch (JsonProcessingException e) {
            throw new MalformedTriggerException("Event " + event.name() + " has no JSON representation");
        }
    }
}
