package io.github.drompincen.crewflow.persistence.document;

import io.github.drompincen.crewflow.protocol.api.MessageStatus;
import io.github.drompincen.crewflow.protocol.api.MessageType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "agent_messages")
@CompoundIndex(name = "inbox_idx", def = "{'projectId': 1, 'toAgentId': 1, 'status': 1, 'createdAt': -1}")
public class AgentMessageDocument {

    @Id
    private String messageId;
    private String projectId;
    private String fromAgentId;
    /** Null for broadcasts, which wake nobody. */
    private String toAgentId;
    private MessageType messageType;
    private String subject;
    private Object payload;
    private int priority = 5;
    private String threadId;
    private MessageStatus status = MessageStatus.PENDING;
    private Instant readAt;
    /** Agents that have seen this broadcast. Unused for direct messages. */
    private List<String> readBy = new ArrayList<>();
    private Instant createdAt;

    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;

    public AgentMessageDocument() {}

    public boolean isDirect() { return toAgentId != null; }

    public boolean isUnreadBy(String agentId) {
        if (isDirect()) return status == MessageStatus.PENDING;
        return readBy == null || !readBy.contains(agentId);
    }

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getFromAgentId() { return fromAgentId; }
    public void setFromAgentId(String fromAgentId) { this.fromAgentId = fromAgentId; }

    public String getToAgentId() { return toAgentId; }
    public void setToAgentId(String toAgentId) { this.toAgentId = toAgentId; }

    public MessageType getMessageType() { return messageType; }
    public void setMessageType(MessageType messageType) { this.messageType = messageType; }

    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }

    public Object getPayload() { return payload; }
    public void setPayload(Object payload) { this.payload = payload; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public MessageStatus getStatus() { return status; }
    public void setStatus(MessageStatus status) { this.status = status; }

    public Instant getReadAt() { return readAt; }
    public void setReadAt(Instant readAt) { this.readAt = readAt; }

    public List<String> getReadBy() { return readBy; }
    public void setReadBy(List<String> readBy) { this.readBy = readBy; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}
