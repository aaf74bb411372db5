package io.github.drompincen.crewflow.runtime.lifecycle;

import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.persistence.document.DecisionDocument;
import io.github.drompincen.crewflow.protocol.api.AgentStatus;
import io.github.drompincen.crewflow.protocol.api.AgentType;
import io.github.drompincen.crewflow.protocol.api.DecisionKind;
import io.github.drompincen.crewflow.protocol.api.DecisionStatus;
import io.github.drompincen.crewflow.runtime.support.InMemoryStore;
import io.github.drompincen.crewflow.runtime.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DecisionReviewServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private final InMemoryStore store = new InMemoryStore();
    private final DecisionReviewService reviews =
            new DecisionReviewService(store.decisionRepository, store.agentRepository, new MutableClock(NOW));

    @BeforeEach
    void setUp() {
        AgentDocument agent = new AgentDocument();
        agent.setAgentId("opt");
        agent.setProjectId("p1");
        agent.setOwnerId("u-lead");
        agent.setAgentType(AgentType.OPTIMIZER);
        agent.setStatus(AgentStatus.ACTIVE);
        store.addAgent(agent);
        for (int i = 1; i <= 4; i++) {
            DecisionDocument d = new DecisionDocument();
            d.setDecisionId("d" + i);
            d.setAgentId("opt");
            d.setProjectId("p1");
            d.setKind(DecisionKind.WORKLOAD_REBALANCE);
            d.setTitle("Rebalance " + i);
            d.setReasoning("Gini 0.4");
            d.setConfidence(0.7);
            d.setCreatedAt(NOW.minusSeconds(60));
            store.addDecision(d);
        }
    }

    @Test
    void trustScoreIsShareOfReviewedDecisionsAccepted() {
        reviews.review("d1", DecisionStatus.ACCEPTED, "u-lead", null);
        assertThat(store.agent("opt").getTrustScore()).isEqualTo(1.0);

        reviews.review("d2", DecisionStatus.REJECTED, "u-lead", "not now");
        assertThat(store.agent("opt").getTrustScore()).isEqualTo(0.5);

        reviews.review("d3", DecisionStatus.MODIFIED, "u-lead", "smaller move");
        reviews.review("d4", DecisionStatus.REJECTED, "u-lead", null);

        AgentDocument agent = store.agent("opt");
        assertThat(agent.getDecisionsReviewed()).isEqualTo(4);
        assertThat(agent.getDecisionsAccepted()).isEqualTo(2);
        assertThat(agent.getTrustScore()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void reviewRecordsReviewerAndNote() {
        DecisionDocument reviewed = reviews.review("d1", DecisionStatus.MODIFIED, "u-lead", "halve it");

        assertThat(reviewed.getStatus()).isEqualTo(DecisionStatus.MODIFIED);
        DecisionDocument stored = store.decisionRepository.findById("d1").orElseThrow();
        assertThat(stored.getReviewedBy()).isEqualTo("u-lead");
        assertThat(stored.getReviewedAt()).isEqualTo(NOW);
        assertThat(stored.getReviewNote()).isEqualTo("halve it");
    }

    @Test
    void decisionCanOnlyBeReviewedOnce() {
        reviews.review("d1", DecisionStatus.ACCEPTED, "u-lead", null);

        assertThatThrownBy(() -> reviews.review("d1", DecisionStatus.REJECTED, "u-other", null))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.agent("opt").getDecisionsReviewed()).isEqualTo(1);
    }

    @Test
    void invalidReviewsAreRejected() {
        assertThatThrownBy(() -> reviews.review("d1", DecisionStatus.PENDING, "u-lead", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reviews.review("d1", null, "u-lead", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reviews.review("missing", DecisionStatus.ACCEPTED, "u-lead", null))
                .isInstanceOf(DecisionNotFoundException.class);
    }
}
