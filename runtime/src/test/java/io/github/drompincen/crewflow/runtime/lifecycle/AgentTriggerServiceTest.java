package io.github.drompincen.crewflow.runtime.lifecycle;

import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.persistence.repository.AgentRepository;
import io.github.drompincen.crewflow.protocol.event.EngineEvent;
import io.github.drompincen.crewflow.protocol.event.EventNames;
import io.github.drompincen.crewflow.runtime.dispatch.EventDispatcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentTriggerServiceTest {

    @Mock AgentRepository agentRepository;
    @Mock EventDispatcher dispatcher;
    @InjectMocks AgentTriggerService triggers;

    @Test
    void thinkNowSendsManualThinkEvent() {
        AgentDocument agent = new AgentDocument();
        agent.setAgentId("a1");
        agent.setProjectId("p1");
        when(agentRepository.findById("a1")).thenReturn(Optional.of(agent));
        when(dispatcher.send(any(EngineEvent.class))).thenReturn(List.of("run-1"));

        assertThat(triggers.thinkNow("a1")).containsExactly("run-1");

        ArgumentCaptor<EngineEvent> event = ArgumentCaptor.forClass(EngineEvent.class);
        verify(dispatcher).send(event.capture());
        assertThat(event.getValue().name()).isEqualTo(EventNames.THINK);
        assertThat(event.getValue().data().path("agentId").asText()).isEqualTo("a1");
        assertThat(event.getValue().data().path("projectId").asText()).isEqualTo("p1");
        assertThat(event.getValue().data().path("trigger").asText()).isEqualTo("manual");
        assertThat(event.getValue().data().path("hop").asInt()).isZero();
    }

    @Test
    void thinkNowForUnknownAgentFails() {
        when(agentRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> triggers.thinkNow("ghost")).isInstanceOf(AgentNotFoundException.class);
        verifyNoInteractions(dispatcher);
    }

    @Test
    void planningCycleCarriesProjectAndInitiator() {
        when(dispatcher.send(any(EngineEvent.class))).thenReturn(List.of("run-2"));

        triggers.startPlanningCycle("p1", "system");

        ArgumentCaptor<EngineEvent> event = ArgumentCaptor.forClass(EngineEvent.class);
        verify(dispatcher).send(event.capture());
        assertThat(event.getValue().name()).isEqualTo(EventNames.PLANNING_CYCLE);
        assertThat(event.getValue().data().path("projectId").asText()).isEqualTo("p1");
        assertThat(event.getValue().data().path("initiatedBy").asText()).isEqualTo("system");
    }

    @Test
    void planningCycleNeedsProject() {
        assertThatThrownBy(() -> triggers.startPlanningCycle(" ", "system")).isInstanceOf(IllegalArgumentException.class);
    }
}
