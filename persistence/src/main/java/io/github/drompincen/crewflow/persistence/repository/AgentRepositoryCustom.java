package io.github.drompincen.crewflow.persistence.repository;

import io.github.drompincen.crewflow.persistence.document.AgentDocument;

import java.time.Instant;
import java.util.List;

public interface AgentRepositoryCustom {

    /**
     * Active agents that never ran or last ran strictly before {@code cutoff}.
     */
    List<AgentDocument> findDueAgents(Instant cutoff, int limit);

    /**
     * Moves {@code lastRunAt} from the observed value to {@code claimedAt} only if nobody else did
     * it first. Returns false when the agent changed in between.
     */
    boolean claimDueRun(String agentId, Instant observedLastRunAt, Instant claimedAt);
}
