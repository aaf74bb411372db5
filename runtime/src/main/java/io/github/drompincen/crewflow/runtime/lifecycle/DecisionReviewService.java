package io.github.drompincen.crewflow.runtime.lifecycle;

import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.persistence.document.DecisionDocument;
import io.github.drompincen.crewflow.persistence.repository.AgentRepository;
import io.github.drompincen.crewflow.persistence.repository.DecisionRepository;
import io.github.drompincen.crewflow.protocol.api.DecisionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Human review of proposed decisions. The agent's trust score is the share of its reviewed
 * decisions that were accepted (as is or modified).
 */
@Service
public class DecisionReviewService {

    private static final Logger log = LoggerFactory.getLogger(DecisionReviewService.class);

    private final DecisionRepository decisionRepository;
    private final AgentRepository agentRepository;
    private final Clock clock;

    public DecisionReviewService(DecisionRepository decisionRepository, AgentRepository agentRepository, Clock clock) {
        this.decisionRepository = decisionRepository;
        this.agentRepository = agentRepository;
        this.clock = clock;
    }

    public DecisionDocument review(String decisionId, DecisionStatus outcome, String reviewerId, String note) {
        if (outcome == null || outcome == DecisionStatus.PENDING) {
            throw new IllegalArgumentException("Review outcome must be ACCEPTED, REJECTED or MODIFIED");
        }
        DecisionDocument decision = decisionRepository.findById(decisionId)
                .orElseThrow(() -> new DecisionNotFoundException(decisionId));
        if (decision.getStatus() != DecisionStatus.PENDING) {
            throw new IllegalStateException("Decision " + decisionId + " was already reviewed: " + decision.getStatus());
        }
        AgentDocument agent = agentRepository.findById(decision.getAgentId())
                .orElseThrow(() -> new AgentNotFoundException(decision.getAgentId()));

        Instant now = clock.instant();
        decision.setStatus(outcome);
        decision.setReviewedBy(reviewerId);
        decision.setReviewedAt(now);
        decision.setReviewNote(note);
        DecisionDocument saved = decisionRepository.save(decision);

        agent.setDecisionsReviewed(agent.getDecisionsReviewed() + 1);
        if (outcome.countsAsAccepted()) {
            agent.setDecisionsAccepted(agent.getDecisionsAccepted() + 1);
        }
        agent.setTrustScore((double) agent.getDecisionsAccepted() / agent.getDecisionsReviewed());
        agent.setUpdatedAt(now);
        agentRepository.save(agent);

        log.info("Decision {} of agent {} reviewed by {}: {} (trust now {})", decisionId, agent.getAgentId(),
                reviewerId, outcome, String.format("%.2f", agent.getTrustScore()));
        return saved;
    }
}
