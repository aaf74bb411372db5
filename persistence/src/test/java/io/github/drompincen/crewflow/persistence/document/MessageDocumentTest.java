package io.github.drompincen.crewflow.persistence.document;

import io.github.drompincen.crewflow.protocol.api.MessageStatus;
import io.github.drompincen.crewflow.protocol.api.MessageType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MessageDocumentTest {

    @Test
    void broadcastHasNoRecipient() {
        AgentMessageDocument msg = new AgentMessageDocument();
        msg.setMessageType(MessageType.BROADCAST);

        assertThat(msg.isDirect()).isFalse();
        assertThat(msg.getPriority()).isEqualTo(5);
    }

    @Test
    void directMessageKeepsPayload() {
        AgentMessageDocument msg = new AgentMessageDocument();
        msg.setToAgentId("b");
        msg.setPayload(Map.of("taskId", "t-1"));

        assertThat(msg.isDirect()).isTrue();
        assertThat(msg.getPayload()).isEqualTo(Map.of("taskId", "t-1"));
    }

    @Test
    void directMessageIsUnreadUntilAcknowledged() {
        AgentMessageDocument msg = new AgentMessageDocument();
        msg.setToAgentId("b");

        assertThat(msg.getStatus()).isEqualTo(MessageStatus.PENDING);
        assertThat(msg.isUnreadBy("b")).isTrue();

        msg.setStatus(MessageStatus.ACKNOWLEDGED);
        assertThat(msg.isUnreadBy("b")).isFalse();
    }

    @Test
    void broadcastIsUnreadPerAgent() {
        AgentMessageDocument msg = new AgentMessageDocument();
        msg.getReadBy().add("a");

        assertThat(msg.isUnreadBy("a")).isFalse();
        assertThat(msg.isUnreadBy("b")).isTrue();
    }

    @Test
    void throttleIdCombinesFunctionAndKey() {
        assertThat(ThrottleDocument.idFor("agent-think", "a1")).isEqualTo("agent-think:a1");
    }
}
