package io.github.drompincen.crewflow.runtime.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.persistence.document.RunDocument;
import io.github.drompincen.crewflow.persistence.repository.RunRepository;
import io.github.drompincen.crewflow.protocol.api.RunStatus;
import io.github.drompincen.crewflow.protocol.event.EngineEvent;
import io.github.drompincen.crewflow.runtime.config.DispatcherProperties;
import io.github.drompincen.crewflow.runtime.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs one claimed attempt of a run and records the outcome: completion, retry with backoff, or
 * failure.
 */
@Service
public class RunExecutor {

    private static final Logger log = LoggerFactory.getLogger(RunExecutor.class);

    private final RunRepository runRepository;
    private final FunctionRegistry functionRegistry;
    private final LeaseRenewalService leaseRenewalService;
    private final DispatcherProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunExecutor(RunRepository runRepository,
                       FunctionRegistry functionRegistry,
                       LeaseRenewalService leaseRenewalService,
                       DispatcherProperties properties,
                       ObjectMapper objectMapper,
                       Clock clock) {
        this.runRepository = runRepository;
        this.functionRegistry = functionRegistry;
        this.leaseRenewalService = leaseRenewalService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void execute(RunDocument claimed) {
        Instant now = clock.instant();
        claimed.setAttempt(claimed.getAttempt() + 1);
        if (claimed.getStartedAt() == null) claimed.setStartedAt(now);
        claimed.setLeaseUntil(now.plus(properties.getLeaseDuration()));
        claimed.setLastUpdatedAt(now);

        RunDocument run;
        try {
            run = runRepository.save(claimed);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Run {} changed before it started, skipping this attempt", claimed.getRunId());
            return;
        }

        MdcContext.setRun(run.getRunId(), run.getFunctionId());
        MemoizingStepRunner steps = new MemoizingStepRunner(run, runRepository, objectMapper, clock,
                properties.getLeaseDuration());
        leaseRenewalService.start(run.getRunId(), run.getLeaseOwner());
        try {
            EngineFunction<?> function = functionRegistry.require(run.getFunctionId());
            EngineEvent event = readEvent(run);
            log.info("Starting run {} of {} (attempt {} of {})", run.getRunId(), run.getFunctionId(),
                    run.getAttempt(), run.getMaxAttempts());
            Object output = function.execute(new FunctionContext(run.getRunId(), event, run.getAttempt(), steps));
            complete(steps.current(), output);
        } catch (NonRetriableException e) {
            fail(steps.current(), e.getMessage());
        } catch (Exception e) {
            handleFailure(steps.current(), e.getMessage());
        } finally {
            leaseRenewalService.stop(run.getRunId());
            MdcContext.clear();
        }
    }

    /**
     * Requeues the run with exponential backoff while attempts remain, otherwise marks it FAILED.
     */
    public void handleFailure(RunDocument run, String error) {
        Instant now = clock.instant();
        run.setError(error);
        run.setLeaseOwner(null);
        run.setLeaseUntil(null);
        run.setLastUpdatedAt(now);
        if (run.getAttempt() < run.getMaxAttempts()) {
            Duration backoff = backoffFor(run.getAttempt());
            run.setStatus(RunStatus.QUEUED);
            run.setScheduledAt(now.plus(backoff));
            log.info("Run {} of {} queued for retry after attempt {} (in {}): {}", run.getRunId(),
                    run.getFunctionId(), run.getAttempt(), backoff, error);
        } else {
            run.setStatus(RunStatus.FAILED);
            run.setEndedAt(now);
            log.warn("Run {} of {} exhausted retries ({} attempts): {}", run.getRunId(),
                    run.getFunctionId(), run.getAttempt(), error);
        }
        saveOutcome(run);
    }

    Duration backoffFor(int attempt) {
        Duration backoff = properties.getRetryBackoff().multipliedBy(1L << Math.min(Math.max(attempt - 1, 0), 20));
        return backoff.compareTo(properties.getMaxRetryBackoff()) > 0 ? properties.getMaxRetryBackoff() : backoff;
    }

    private void complete(RunDocument run, Object output) throws JsonProcessingException {
        Instant now = clock.instant();
        run.setStatus(RunStatus.COMPLETED);
        run.setOutput(objectMapper.writeValueAsString(output));
        run.setError(null);
        run.setEndedAt(now);
        run.setLeaseOwner(null);
        run.setLeaseUntil(null);
        run.setLastUpdatedAt(now);
        saveOutcome(run);
        log.info("Run {} of {} completed in {}ms", run.getRunId(), run.getFunctionId(),
                now.toEpochMilli() - run.getStartedAt().toEpochMilli());
    }

    private void fail(RunDocument run, String error) {
        Instant now = clock.instant();
        run.setStatus(RunStatus.FAILED);
        run.setError(error);
        run.setEndedAt(now);
        run.setLeaseOwner(null);
        run.setLeaseUntil(null);
        run.setLastUpdatedAt(now);
        saveOutcome(run);
        log.warn("Run {} of {} failed without retry: {}", run.getRunId(), run.getFunctionId(), error);
    }

    private void saveOutcome(RunDocument run) {
        try {
            runRepository.save(run);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Run {} was taken over before its outcome ({}) could be saved", run.getRunId(), run.getStatus());
        }
    }

    private EngineEvent readEvent(RunDocument run) {
        try {
            JsonNode data = run.getEventData() == null
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(run.getEventData());
            return new EngineEvent(run.getEventId(), run.getEventName(), data, run.getCreatedAt());
        } catch (JsonProcessingException e) {
            throw new MalformedTriggerException("Event data of run " + run.getRunId() + " is not valid JSON");
        }
    }
}
