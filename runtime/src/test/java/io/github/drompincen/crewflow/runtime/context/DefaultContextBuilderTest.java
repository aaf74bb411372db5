package io.github.drompincen.crewflow.runtime.context;

import io.github.drompincen.crewflow.persistence.document.AgentMessageDocument;
import io.github.drompincen.crewflow.persistence.document.DecisionDocument;
import io.github.drompincen.crewflow.protocol.api.AgentStatus;
import io.github.drompincen.crewflow.protocol.api.AgentType;
import io.github.drompincen.crewflow.protocol.api.DecisionKind;
import io.github.drompincen.crewflow.protocol.api.MessageStatus;
import io.github.drompincen.crewflow.protocol.api.MessageType;
import io.github.drompincen.crewflow.runtime.agent.ThinkContext;
import io.github.drompincen.crewflow.runtime.lifecycle.AgentNotFoundException;
import io.github.drompincen.crewflow.runtime.support.EngineHarness;
import io.github.drompincen.crewflow.runtime.agent.ThinkResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static io.github.drompincen.crewflow.runtime.support.EngineHarness.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultContextBuilderTest {

    private final EngineHarness harness = new EngineHarness(
            ctx -> ThinkResult.noAction("", ""), ctx -> ThinkResult.noAction("", ""), ctx -> ThinkResult.noAction("", ""));

    @BeforeEach
    void setUp() {
        harness.addAgent("alice", "p1", "u-alice", AgentType.DEVELOPER, null);
        harness.addAgent("bob", "p1", "u-bob", AgentType.DEVELOPER, null);
        harness.addAgent("mgr", "p1", "u-lead", AgentType.MANAGER, null);
        harness.addAgent("outsider", "p2", "u-x", AgentType.DEVELOPER, null);
        var paused = harness.addAgent("carol", "p1", "u-carol", AgentType.DEVELOPER, null);
        paused.setStatus(AgentStatus.PAUSED);
        harness.store.agentRepository.save(paused);
    }

    @Test
    void inboxHoldsDirectAndForeignBroadcastsOrderedByPriorityThenAge() {
        message("m-old-direct", "bob", "alice", 5, START.minus(Duration.ofHours(2)));
        message("m-urgent", "mgr", "alice", 1, START.minus(Duration.ofMinutes(5)));
        message("m-broadcast", "mgr", null, 5, START.minus(Duration.ofHours(1)));
        message("m-own-broadcast", "alice", null, 1, START.minus(Duration.ofMinutes(1)));
        message("m-for-bob", "mgr", "bob", 1, START.minus(Duration.ofMinutes(1)));
        message("m-expired", "bob", "alice", 1, START.minus(Duration.ofHours(49)));
        message("m-other-project", "outsider", null, 1, START.minus(Duration.ofMinutes(1)), "p2");

        ThinkContext context = harness.contextBuilder.build("alice");

        assertThat(context.pendingMessages())
                .extracting(ThinkContext.PendingMessage::messageId)
                .containsExactly("m-urgent", "m-old-direct", "m-broadcast");
        assertThat(context.pendingMessages().get(0).payload().path("task").asText()).isEqualTo("T-1");
    }

    @Test
    void readMessagesLeaveTheInboxOfTheReaderOnly() {
        message("m-direct", "bob", "alice", 5, START.minus(Duration.ofMinutes(10)));
        message("m-broadcast", "mgr", null, 5, START.minus(Duration.ofMinutes(5)));

        ThinkContext first = harness.contextBuilder.build("alice");
        harness.messageBus.acknowledge("alice", first.pendingMessageIds());

        assertThat(first.pendingMessageIds()).containsExactly("m-direct", "m-broadcast");
        assertThat(harness.contextBuilder.build("alice").pendingMessages()).isEmpty();
        assertThat(harness.contextBuilder.build("bob").pendingMessageIds()).containsExactly("m-broadcast");
        assertThat(harness.store.messages())
                .filteredOn(m -> m.getMessageId().equals("m-broadcast"))
                .singleElement()
                .satisfies(m -> {
                    assertThat(m.getStatus()).isEqualTo(MessageStatus.PENDING);
                    assertThat(m.getReadBy()).containsExactly("alice");
                });
    }

    @Test
    void acknowledgingAnotherAgentsDirectMessageChangesNothing() {
        message("m-for-bob", "mgr", "bob", 5, START.minus(Duration.ofMinutes(1)));

        assertThat(harness.messageBus.acknowledge("alice", List.of("m-for-bob"))).isZero();
        assertThat(harness.contextBuilder.build("bob").pendingMessageIds()).containsExactly("m-for-bob");
    }

    @Test
    void inboxIsCappedAtConfiguredLimit() {
        harness.agentProperties.setPendingMessageLimit(2);
        for (int i = 0; i < 5; i++) {
            message("m" + i, "bob", "alice", 5, START.minusSeconds(60 - i));
        }

        assertThat(harness.contextBuilder.build("alice").pendingMessages())
                .extracting(ThinkContext.PendingMessage::messageId)
                .containsExactly("m0", "m1");
    }

    @Test
    void teammatesAreActiveAgentsOfSameProjectExceptSelf() {
        ThinkContext context = harness.contextBuilder.build("alice");

        assertThat(context.agentType()).isEqualTo(AgentType.DEVELOPER);
        assertThat(context.ownerId()).isEqualTo("u-alice");
        assertThat(context.trustScore()).isEqualTo(0.5);
        assertThat(context.teammates()).extracting(ThinkContext.Teammate::agentId).containsExactly("bob", "mgr");
        assertThat(context.hasTeammate("carol")).isFalse();
        assertThat(context.builtAt()).isEqualTo(START);
        assertThat(context.projectSnapshot().isObject()).isTrue();
    }

    @Test
    void recentDecisionsAreNewestFirstAndLimited() {
        harness.agentProperties.setRecentDecisionLimit(2);
        decision("d1", START.minus(Duration.ofHours(3)));
        decision("d2", START.minus(Duration.ofHours(2)));
        decision("d3", START.minus(Duration.ofHours(1)));

        assertThat(harness.contextBuilder.build("alice").recentDecisions())
                .extracting(ThinkContext.RecentDecision::decisionId)
                .containsExactly("d3", "d2");
    }

    @Test
    void unknownAgentIsReported() {
        assertThatThrownBy(() -> harness.contextBuilder.build("ghost"))
                .isInstanceOf(AgentNotFoundException.class)
                .hasMessageContaining("ghost");
    }

    private void message(String id, String from, String to, int priority, Instant createdAt) {
        message(id, from, to, priority, createdAt, "p1");
    }

    private void message(String id, String from, String to, int priority, Instant createdAt, String projectId) {
        AgentMessageDocument m = new AgentMessageDocument();
        m.setMessageId(id);
        m.setProjectId(projectId);
        m.setFromAgentId(from);
        m.setToAgentId(to);
        m.setMessageType(MessageType.STATUS_UPDATE);
        m.setSubject("subject " + id);
        m.setPayload(Map.of("task", "T-1"));
        m.setPriority(priority);
        m.setThreadId(id);
        m.setCreatedAt(createdAt);
        m.setExpiresAt(createdAt.plus(Duration.ofHours(48)));
        harness.store.addMessage(m);
    }

    private void decision(String id, Instant createdAt) {
        DecisionDocument d = new DecisionDocument();
        d.setDecisionId(id);
        d.setAgentId("alice");
        d.setProjectId("p1");
        d.setKind(DecisionKind.DEADLINE_EXTENSION);
        d.setTitle(id);
        d.setReasoning("r");
        d.setConfidence(0.7);
        d.setCreatedAt(createdAt);
        harness.store.addDecision(d);
    }
}
