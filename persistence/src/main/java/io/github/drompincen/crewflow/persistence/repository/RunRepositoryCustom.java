package io.github.drompincen.crewflow.persistence.repository;

import java.time.Instant;

public interface RunRepositoryCustom {

    /**
     * Pushes the lease forward while {@code owner} still holds a RUNNING run. Leaves the document
     * version untouched so the executing worker can keep saving step results.
     */
    boolean extendLease(String runId, String owner, Instant leaseUntil);
}
