package io.github.drompincen.crewflow.runtime.agent;

import io.github.drompincen.crewflow.protocol.api.AgentType;
import io.github.drompincen.crewflow.protocol.api.DecisionKind;
import io.github.drompincen.crewflow.protocol.api.DecisionStatus;
import io.github.drompincen.crewflow.protocol.api.MessageType;
import io.github.drompincen.crewflow.runtime.agent.llm.OfflineReasoningClient;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.drompincen.crewflow.runtime.agent.ContextFixtures.MAPPER;
import static io.github.drompincen.crewflow.runtime.agent.ContextFixtures.NOW;
import static io.github.drompincen.crewflow.runtime.agent.ContextFixtures.context;
import static io.github.drompincen.crewflow.runtime.agent.ContextFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RoleAnalysisTest {

    private static final String UNEVEN_TEAM = """
            {"deliveryConfidence":45,"teamCapacity":[
              {"userId":"alice","userName":"Alice","utilization":0,"availableHours":30,"burnoutRisk":10},
              {"userId":"bob","userName":"Bob","utilization":0,"burnoutRisk":20},
              {"userId":"carol","userName":"Carol","utilization":0,"burnoutRisk":15},
              {"userId":"dave","userName":"Dave","utilization":160,"burnoutRisk":75}]}""";

    private final OfflineReasoningClient offline = new OfflineReasoningClient();

    @Test
    void giniIsZeroForEvenLoadAndGrowsWithConcentration() {
        assertThat(OptimizerBehavior.gini(new double[]{80, 80, 80})).isZero();
        assertThat(OptimizerBehavior.gini(new double[]{0, 0, 0, 100})).isCloseTo(0.75, within(1e-9));
        assertThat(OptimizerBehavior.gini(new double[0])).isZero();
        assertThat(OptimizerBehavior.gini(new double[]{0, 0})).isZero();
    }

    @Test
    void optimizerFlagsUnevenWorkloadAndTrackRecord() {
        OptimizerBehavior optimizer = new OptimizerBehavior(offline, MAPPER);
        ThinkContext ctx = context(AgentType.OPTIMIZER, "lead", json(UNEVEN_TEAM), List.of(), List.of(
                new ThinkContext.RecentDecision("d1", DecisionKind.WORKLOAD_REBALANCE, DecisionStatus.ACCEPTED, "a", 0.8, NOW),
                new ThinkContext.RecentDecision("d2", DecisionKind.WORKLOAD_REBALANCE, DecisionStatus.MODIFIED, "b", 0.7, NOW),
                new ThinkContext.RecentDecision("d3", DecisionKind.WORKLOAD_REBALANCE, DecisionStatus.REJECTED, "c", 0.6, NOW)));

        String analysis = optimizer.roleContext(ctx);

        assertThat(OptimizerBehavior.utilizations(ctx.projectSnapshot())).containsExactly(0, 0, 0, 160);
        assertThat(analysis)
                .contains("## Optimizer Analysis")
                .contains("HIGH VARIANCE")
                .contains("(unequal)")
                .contains("Total: 3, Accepted: 2, Rejected: 1");
    }

    @Test
    void managerReportsDeliveryRiskOverloadBurnoutAndHelpRequests() {
        ManagerBehavior manager = new ManagerBehavior(offline, MAPPER);
        ThinkContext ctx = context(AgentType.MANAGER, "lead", json(UNEVEN_TEAM), List.of(
                new ThinkContext.PendingMessage("m1", "agent-bob", "agent-lead", MessageType.HELP_REQUEST,
                        "Stuck on auth", MAPPER.createObjectNode(), 3, "m1", NOW)), List.of());

        String analysis = manager.roleContext(ctx);

        assertThat(analysis)
                .contains("CRITICAL: delivery confidence is 45%")
                .contains("Overloaded members: Dave at 160%")
                .contains("Burnout risk: Dave at 75%")
                .contains("1 open HELP_REQUEST message(s)");
    }

    @Test
    void managerWarnsBetweenFiftyAndSeventyPercentConfidence() {
        ManagerBehavior manager = new ManagerBehavior(offline, MAPPER);
        ThinkContext ctx = context(AgentType.MANAGER, "lead", json("{\"deliveryConfidence\":65}"), List.of(), List.of());

        assertThat(manager.roleContext(ctx)).contains("WARNING: delivery confidence is 65%");
    }

    @Test
    void developerWithSpareCapacityIsPointedAtOverloadedTeammates() {
        DeveloperBehavior developer = new DeveloperBehavior(offline, MAPPER);
        ThinkContext ctx = context(AgentType.DEVELOPER, "alice", json(UNEVEN_TEAM), List.of(), List.of());

        assertThat(developer.roleContext(ctx))
                .contains("You have spare capacity (30h free)")
                .contains("Teammates who might need help: Dave (160% utilized)");
    }

    @Test
    void developerAbsentFromSnapshotGetsNoAnalysis() {
        DeveloperBehavior developer = new DeveloperBehavior(offline, MAPPER);
        ThinkContext ctx = context(AgentType.DEVELOPER, "zoe", json(UNEVEN_TEAM), List.of(), List.of());

        assertThat(developer.roleContext(ctx)).isEmpty();
    }

    @Test
    void offlineProviderYieldsSingleNoAction() {
        ThinkResult result = new ManagerBehavior(offline, MAPPER)
                .think(context(AgentType.MANAGER, "lead", MAPPER.createObjectNode(), List.of(), List.of()));

        assertThat(result.actions()).containsExactly(new AgentAction.NoAction("Offline reasoning provider"));
    }

    @Test
    void registryMapsEveryAgentType() {
        AgentBehavior optimizer = ctx -> ThinkResult.noAction("o", "o");
        AgentBehavior manager = ctx -> ThinkResult.noAction("m", "m");
        AgentBehavior developer = ctx -> ThinkResult.noAction("d", "d");
        BehaviorRegistry registry = new BehaviorRegistry(optimizer, manager, developer);

        assertThat(registry.behaviorFor(AgentType.OPTIMIZER)).isSameAs(optimizer);
        assertThat(registry.behaviorFor(AgentType.MANAGER)).isSameAs(manager);
        assertThat(registry.behaviorFor(AgentType.DEVELOPER)).isSameAs(developer);
    }
}
