package io.github.drompincen.crewflow.runtime.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.persistence.document.RunDocument;
import io.github.drompincen.crewflow.persistence.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Step checkpoints stored on the run document. One instance per attempt.
 */
public class MemoizingStepRunner implements StepRunner {

    private static final Logger log = LoggerFactory.getLogger(MemoizingStepRunner.class);

    private final RunRepository runRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration leaseDuration;
    private final Set<String> seen = new HashSet<>();
    private RunDocument run;

    public MemoizingStepRunner(RunDocument run, RunRepository runRepository, ObjectMapper objectMapper,
                               Clock clock, Duration leaseDuration) {
        this.run = run;
        this.runRepository = runRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.leaseDuration = leaseDuration;
    }

    @Override
    public <T> T run(String name, Class<T> type, Callable<T> body) {
        return doRun(name, objectMapper.getTypeFactory().constructType(type), body);
    }

    @Override
    public <T> T run(String name, TypeReference<T> type, Callable<T> body) {
        return doRun(name, objectMapper.getTypeFactory().constructType(type), body);
    }

    /** The latest saved state of the run. */
    public RunDocument current() {
        return run;
    }

    private <T> T doRun(String name, JavaType type, Callable<T> body) {
        if (!seen.add(name)) {
            throw new NonRetriableException("Duplicate step name '" + name + "' in run " + run.getRunId());
        }

        Optional<RunDocument.StepRecord> memo = run.findStep(name);
        if (memo.isPresent()) {
            log.debug("Replaying step {} of run {}", name, run.getRunId());
            return read(name, memo.get().getOutput(), type);
        }

        T result;
        try {
            result = body.call();
        } catch (NonRetriableException e) {
            throw e;
        } catch (Exception e) {
            throw new StepExecutionException(name, e);
        }

        Instant now = clock.instant();
        run.getSteps().add(new RunDocument.StepRecord(name, write(name, result), now));
        run.setLeaseUntil(now.plus(leaseDuration));
        run.setLastUpdatedAt(now);
        run = runRepository.save(run);
        log.debug("Checkpointed step {} of run {}", name, run.getRunId());
        return result;
    }

    private String write(String name, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException(name, e);
        }
    }

    private <T> T read(String name, String json, JavaType type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new NonRetriableException("Checkpoint of step '" + name + "' is unreadable", e);
        }
    }
}
