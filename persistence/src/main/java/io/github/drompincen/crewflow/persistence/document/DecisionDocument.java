package io.github.drompincen.crewflow.persistence.document;

import io.github.drompincen.crewflow.protocol.api.DecisionKind;
import io.github.drompincen.crewflow.protocol.api.DecisionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "agent_decisions")
@CompoundIndex(name = "agent_recent_idx", def = "{'projectId': 1, 'agentId': 1, 'createdAt': -1}")
public class DecisionDocument {

    @Id
    private String decisionId;
    private String agentId;
    private String projectId;
    private DecisionKind kind;
    private DecisionStatus status = DecisionStatus.PENDING;
    private String title;
    private String description;
    private String reasoning;
    private double confidence;
    private Object payload;
    private String threadId;
    private Instant createdAt;
    private String reviewedBy;
    private Instant reviewedAt;
    private String reviewNote;

    public DecisionDocument() {}

    public String getDecisionId() { return decisionId; }
    public void setDecisionId(String decisionId) { this.decisionId = decisionId; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public DecisionKind getKind() { return kind; }
    public void setKind(DecisionKind kind) { this.kind = kind; }

    public DecisionStatus getStatus() { return status; }
    public void setStatus(DecisionStatus status) { this.status = status; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getReasoning() { return reasoning; }
    public void setReasoning(String reasoning) { this.reasoning = reasoning; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    public Object getPayload() { return payload; }
    public void setPayload(Object payload) { this.payload = payload; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public String getReviewedBy() { return reviewedBy; }
    public void setReviewedBy(String reviewedBy) { this.reviewedBy = reviewedBy; }

    public Instant getReviewedAt() { return reviewedAt; }
    public void setReviewedAt(Instant reviewedAt) { this.reviewedAt = reviewedAt; }

    public String getReviewNote() { return reviewNote; }
    public void setReviewNote(String reviewNote) { this.reviewNote = reviewNote; }
}
