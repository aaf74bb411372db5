package io.github.drompincen.crewflow.runtime.agent;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.crewflow.protocol.api.DecisionKind;
import io.github.drompincen.crewflow.protocol.api.MessageType;

/**
 * One thing an agent decided to do in a think cycle.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AgentAction.SendMessageAction.class, name = "send_message"),
        @JsonSubTypes.Type(value = AgentAction.ProposeDecisionAction.class, name = "propose_decision"),
        @JsonSubTypes.Type(value = AgentAction.NoAction.class, name = "no_action")
})
public interface AgentAction {

    /** A null {@code toAgentId} is a broadcast. */
    record SendMessageAction(
            String toAgentId,
            MessageType messageType,
            String subject,
            JsonNode payload,
            int priority,
            String threadId
    ) implements AgentAction {}

    record ProposeDecisionAction(
            DecisionKind decisionKind,
            String title,
            String description,
            String reasoning,
            double confidence,
            JsonNode payload,
            String threadId
    ) implements AgentAction {}

    record NoAction(String reason) implements AgentAction {}
}
