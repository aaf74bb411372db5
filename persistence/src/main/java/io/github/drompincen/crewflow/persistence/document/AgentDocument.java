package io.github.drompincen.crewflow.persistence.document;

import io.github.drompincen.crewflow.protocol.api.AgentStatus;
import io.github.drompincen.crewflow.protocol.api.AgentType;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "agents")
@CompoundIndex(name = "due_idx", def = "{'status': 1, 'lastRunAt': 1}")
@CompoundIndex(name = "project_roster_idx", def = "{'projectId': 1, 'status': 1, 'createdAt': 1}")
public class AgentDocument {

    @Id
    private String agentId;
    private String projectId;
    private String ownerId;
    private AgentType agentType;
    private AgentStatus status = AgentStatus.ACTIVE;
    private Instant lastRunAt;
    private double trustScore = 0.5;
    private int decisionsReviewed;
    private int decisionsAccepted;
    private Instant createdAt;
    private Instant updatedAt;
    @Version
    private Long version;

    public AgentDocument() {}

    public boolean isActive() { return status == AgentStatus.ACTIVE; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public AgentType getAgentType() { return agentType; }
    public void setAgentType(AgentType agentType) { this.agentType = agentType; }

    public AgentStatus getStatus() { return status; }
    public void setStatus(AgentStatus status) { this.status = status; }

    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }

    public double getTrustScore() { return trustScore; }
    public void setTrustScore(double trustScore) { this.trustScore = trustScore; }

    public int getDecisionsReviewed() { return decisionsReviewed; }
    public void setDecisionsReviewed(int decisionsReviewed) { this.decisionsReviewed = decisionsReviewed; }

    public int getDecisionsAccepted() { return decisionsAccepted; }
    public void setDecisionsAccepted(int decisionsAccepted) { this.decisionsAccepted = decisionsAccepted; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
