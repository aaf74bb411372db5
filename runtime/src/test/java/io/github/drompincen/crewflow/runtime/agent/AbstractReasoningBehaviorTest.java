package io.github.drompincen.crewflow.runtime.agent;

import io.github.drompincen.crewflow.protocol.api.AgentType;
import io.github.drompincen.crewflow.protocol.api.DecisionKind;
import io.github.drompincen.crewflow.protocol.api.DecisionStatus;
import io.github.drompincen.crewflow.protocol.api.MessageType;
import io.github.drompincen.crewflow.runtime.agent.llm.ReasoningClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static io.github.drompincen.crewflow.runtime.agent.ContextFixtures.MAPPER;
import static io.github.drompincen.crewflow.runtime.agent.ContextFixtures.NOW;
import static io.github.drompincen.crewflow.runtime.agent.ContextFixtures.context;
import static io.github.drompincen.crewflow.runtime.agent.ContextFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AbstractReasoningBehaviorTest {

    @Mock ReasoningClient reasoningClient;

    private DeveloperBehavior behavior;
    private ThinkContext context;

    @BeforeEach
    void setUp() {
        behavior = new DeveloperBehavior(reasoningClient, MAPPER);
        context = context(AgentType.DEVELOPER, "alice", MAPPER.createObjectNode(), List.of(), List.of());
    }

    @Test
    void missingFieldsFallBackToDefaults() {
        ThinkResult result = behavior.parseResponse("""
                {"actions":[{"kind":"send_message","toAgentId":"agent-bob"},
                            {"kind":"propose_decision"},
                            {"kind":"something_else"}]}""");

        assertThat(result.reasoning()).startsWith("{\"actions\"");
        AgentAction.SendMessageAction send = (AgentAction.SendMessageAction) result.actions().get(0);
        assertThat(send.messageType()).isEqualTo(MessageType.STATUS_UPDATE);
        assertThat(send.subject()).isEqualTo("Update");
        assertThat(send.priority()).isEqualTo(5);

        AgentAction.ProposeDecisionAction propose = (AgentAction.ProposeDecisionAction) result.actions().get(1);
        assertThat(propose.decisionKind()).isEqualTo(DecisionKind.WORKLOAD_REBALANCE);
        assertThat(propose.title()).isEqualTo("Decision");
        assertThat(propose.confidence()).isEqualTo(0.5);

        assertThat(result.actions().get(2)).isEqualTo(new AgentAction.NoAction("No action needed"));
    }

    @Test
    void jsonIsExtractedFromSurroundingProse() {
        ThinkResult result = behavior.parseResponse("""
                Here is my plan:
                {"reasoning":"Bob is overloaded","actions":[{"kind":"propose_decision","decisionType":"task_reassignment",
                 "title":"Move API work","reasoning":"Bob at 130%","confidence":0.8,"actionPayload":{"taskId":"T-9"}}]}
                Let me know.""");

        assertThat(result.reasoning()).isEqualTo("Bob is overloaded");
        AgentAction.ProposeDecisionAction propose = (AgentAction.ProposeDecisionAction) result.actions().get(0);
        assertThat(propose.decisionKind()).isEqualTo(DecisionKind.TASK_REASSIGNMENT);
        assertThat(propose.payload().path("taskId").asText()).isEqualTo("T-9");
    }

    @Test
    void responseWithoutJsonBecomesNoAction() {
        ThinkResult result = behavior.parseResponse("I could not decide.");

        assertThat(result.reasoning()).isEqualTo("I could not decide.");
        assertThat(result.actions()).containsExactly(new AgentAction.NoAction("Failed to parse reasoning response"));
    }

    @Test
    void brokenJsonBecomesNoAction() {
        ThinkResult result = behavior.parseResponse("{\"reasoning\": \"cut off");

        assertThat(result.actions()).hasSize(1);
        ThinkResult alsoBroken = behavior.parseResponse("{\"reasoning\": oops}");
        assertThat(alsoBroken.actions()).containsExactly(new AgentAction.NoAction("JSON parse error in reasoning response"));
    }

    @Test
    void invalidActionsAreDropped() {
        when(reasoningClient.complete(anyString(), anyString())).thenReturn("""
                {"reasoning":"mixed bag","actions":[
                  {"kind":"propose_decision","decisionType":"DEADLINE_EXTENSION","title":"Too sure","reasoning":"r","confidence":1.5},
                  {"kind":"propose_decision","decisionType":"DEADLINE_EXTENSION","title":"  ","reasoning":"r","confidence":0.7},
                  {"kind":"propose_decision","decisionType":"NOT_A_KIND","title":"t","reasoning":"r","confidence":0.7},
                  {"kind":"send_message","toAgentId":"agent-stranger","subject":"hi"},
                  {"kind":"send_message","toAgentId":"agent-bob","messageType":"HELP_REQUEST","subject":"  "},
                  {"kind":"send_message","toAgentId":null,"messageType":"BROADCAST","subject":"Standup moved"},
                  {"kind":"send_message","toAgentId":"agent-bob","messageType":"TASK_OFFER","subject":"I can take T-3","priority":2},
                  {"kind":"propose_decision","decisionType":"HELP_REQUEST","title":"Pair on auth","reasoning":"blocked","confidence":0.9}
                ]}""");

        ThinkResult result = behavior.think(context);

        assertThat(result.reasoning()).isEqualTo("mixed bag");
        assertThat(result.actions()).hasSize(3);
        assertThat(((AgentAction.SendMessageAction) result.actions().get(0)).toAgentId()).isNull();
        assertThat(((AgentAction.SendMessageAction) result.actions().get(1)).priority()).isEqualTo(2);
        assertThat(((AgentAction.ProposeDecisionAction) result.actions().get(2)).title()).isEqualTo("Pair on auth");
    }

    @Test
    void promptDescribesAgentTeamInboxAndHistory() {
        ThinkContext rich = context(AgentType.DEVELOPER, "alice",
                json("{\"sprint\":\"S12\",\"teamCapacity\":[{\"userId\":\"alice\",\"utilization\":120}]}"),
                List.of(new ThinkContext.PendingMessage("m1", "agent-mgr", "agent-alice", MessageType.HELP_REQUEST,
                        "Need a reviewer", json("{\"taskId\":\"T-1\"}"), 2, "m1", NOW)),
                List.of(new ThinkContext.RecentDecision("d1", DecisionKind.DEADLINE_EXTENSION, DecisionStatus.ACCEPTED,
                        "Push demo", 0.8, NOW)));
        when(reasoningClient.complete(anyString(), anyString())).thenReturn("{\"reasoning\":\"ok\",\"actions\":[]}");

        behavior.think(rich);

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(reasoningClient).complete(system.capture(), prompt.capture());
        assertThat(system.getValue()).contains("Developer Agent");
        assertThat(prompt.getValue())
                .contains("You are the Developer agent for owner alice on project p1.")
                .contains("Your trust score: 75%")
                .contains("## Project Status")
                .contains("- agent-bob: DEVELOPER agent of bob")
                .contains("[HELP_REQUEST] from agent-mgr (priority 2): \"Need a reviewer\"")
                .contains("[ACCEPTED] DEADLINE_EXTENSION: \"Push demo\" (confidence: 80%)")
                .contains("You are OVERLOADED at 120% utilization")
                .endsWith("- Keep actions to 1-3 per cycle.");
    }

    @Test
    void emptySnapshotAndInboxAreLeftOutOfPrompt() {
        String prompt = behavior.buildPrompt(context);

        assertThat(prompt)
                .doesNotContain("## Project Status")
                .doesNotContain("## Incoming Messages")
                .doesNotContain("## Recent Decisions")
                .contains("## Response Format");
    }
}
