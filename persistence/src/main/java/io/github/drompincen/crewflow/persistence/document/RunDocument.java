package io.github.drompincen.crewflow.persistence.document;

import io.github.drompincen.crewflow.protocol.api.RunStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One execution of an engine function for one event, including its memoized step outputs.
 */
@Document(collection = "engine_runs")
@CompoundIndex(name = "run_pickup_idx", def = "{'status': 1, 'scheduledAt': 1}")
@CompoundIndex(name = "run_throttle_idx", def = "{'functionId': 1, 'throttleKey': 1, 'status': 1}")
@CompoundIndex(name = "run_lease_idx", def = "{'status': 1, 'leaseUntil': 1}")
public class RunDocument {

    @Id
    private String runId;
    private String functionId;
    private String eventId;
    private String eventName;
    /** Event payload as JSON. */
    private String eventData;
    private String throttleKey;
    private RunStatus status = RunStatus.QUEUED;
    private int attempt;
    private int maxAttempts = 1;
    private Instant scheduledAt;
    private Instant createdAt;
    private Instant startedAt;
    /** Set once the throttle has let the run through; later claims skip the throttle. */
    private Instant admittedAt;
    private Instant endedAt;
    private String leaseOwner;
    private Instant leaseUntil;
    private List<StepRecord> steps = new ArrayList<>();
    private String output;
    private String error;
    private int coalescedEvents;
    private Instant lastUpdatedAt;
    @Version
    private Long version;

    public RunDocument() {}

    public Optional<StepRecord> findStep(String name) {
        return steps.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }
    public String getFunctionId() { return functionId; }
    public void setFunctionId(String functionId) { this.functionId = functionId; }
    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }
    public String getEventName() { return eventName; }
    public void setEventName(String eventName) { this.eventName = eventName; }
    public String getEventData() { return eventData; }
    public void setEventData(String eventData) { this.eventData = eventData; }
    public String getThrottleKey() { return throttleKey; }
    public void setThrottleKey(String throttleKey) { this.throttleKey = throttleKey; }
    public RunStatus getStatus() { return status; }
    public void setStatus(RunStatus status) { this.status = status; }
    public int getAttempt() { return attempt; }
    public void setAttempt(int attempt) { this.attempt = attempt; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public Instant getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(Instant scheduledAt) { this.scheduledAt = scheduledAt; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getAdmittedAt() { return admittedAt; }
    public void setAdmittedAt(Instant admittedAt) { this.admittedAt = admittedAt; }
    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }
    public String getLeaseOwner() { return leaseOwner; }
    public void setLeaseOwner(String leaseOwner) { this.leaseOwner = leaseOwner; }
    public Instant getLeaseUntil() { return leaseUntil; }
    public void setLeaseUntil(Instant leaseUntil) { this.leaseUntil = leaseUntil; }
    public List<StepRecord> getSteps() { return steps; }
    public void setSteps(List<StepRecord> steps) { this.steps = steps; }
    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public int getCoalescedEvents() { return coalescedEvents; }
    public void setCoalescedEvents(int coalescedEvents) { this.coalescedEvents = coalescedEvents; }
    public Instant getLastUpdatedAt() { return lastUpdatedAt; }
    public void setLastUpdatedAt(Instant lastUpdatedAt) { this.lastUpdatedAt = lastUpdatedAt; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }

    public static class StepRecord {
        private String name;
        /** Step result as JSON. */
        private String output;
        private Instant completedAt;

        public StepRecord() {}

        public StepRecord(String name, String output, Instant completedAt) {
            this.name = name;
            this.output = output;
            this.completedAt = completedAt;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getOutput() { return output; }
        public void setOutput(String output) { this.output = output; }
        public Instant getCompletedAt() { return completedAt; }
        public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    }
}
