package io.github.drompincen.crewflow.runtime.lifecycle;

import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.persistence.repository.AgentRepository;
import io.github.drompincen.crewflow.protocol.api.AgentStatus;
import io.github.drompincen.crewflow.protocol.api.AgentType;
import io.github.drompincen.crewflow.protocol.api.ProjectMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Provisioning and status transitions. Agents are never deleted; ARCHIVED is terminal.
 */
@Service
public class AgentLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(AgentLifecycleService.class);

    private final AgentRepository agentRepository;
    private final Clock clock;

    public AgentLifecycleService(AgentRepository agentRepository, Clock clock) {
        this.agentRepository = agentRepository;
        this.clock = clock;
    }

    /**
     * Creates the agents a project is missing: a DEVELOPER per member, plus one MANAGER and one
     * OPTIMIZER owned by the first admin (or the first member). Returns the created agents.
     */
    public List<AgentDocument> ensureProjectAgents(String projectId, List<ProjectMember> members) {
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        List<AgentDocument> existing = agentRepository.findByProjectIdOrderByCreatedAtAsc(projectId);
        List<AgentDocument> created = new ArrayList<>();

        for (ProjectMember member : members) {
            boolean hasDeveloper = existing.stream().anyMatch(a ->
                    a.getAgentType() == AgentType.DEVELOPER && member.userId().equals(a.getOwnerId()));
            if (!hasDeveloper) {
                created.add(create(projectId, member.userId(), AgentType.DEVELOPER));
            }
        }

        String owner = members.stream().filter(ProjectMember::admin).findFirst()
                .orElse(members.get(0)).userId();
        if (existing.stream().noneMatch(a -> a.getAgentType() == AgentType.MANAGER)) {
            created.add(create(projectId, owner, AgentType.MANAGER));
        }
        if (existing.stream().noneMatch(a -> a.getAgentType() == AgentType.OPTIMIZER)) {
            created.add(create(projectId, owner, AgentType.OPTIMIZER));
        }

        if (!created.isEmpty()) {
            log.info("Provisioned {} agent(s) for project {}", created.size(), projectId);
        }
        return created;
    }

    public AgentDocument setStatus(String agentId, AgentStatus status) {
        AgentDocument agent = agentRepository.findById(agentId)
                .orElseThrow(() -> new AgentNotFoundException(agentId));
        if (agent.getStatus() == status) {
            return agent;
        }
        if (agent.getStatus() == AgentStatus.ARCHIVED) {
            throw new IllegalStateException("Agent " + agentId + " is archived");
        }
        agent.setStatus(status);
        agent.setUpdatedAt(clock.instant());
        log.info("Agent {} is now {}", agentId, status);
        return agentRepository.save(agent);
    }

    /** ACTIVE becomes PAUSED and PAUSED becomes ACTIVE. */
    public AgentDocument toggle(String agentId) {
        AgentDocument agent = agentRepository.findById(agentId)
                .orElseThrow(() -> new AgentNotFoundException(agentId));
        AgentStatus next = agent.getStatus() == AgentStatus.ACTIVE ? AgentStatus.PAUSED : AgentStatus.ACTIVE;
        return setStatus(agentId, next);
    }

    public AgentDocument archive(String agentId) {
        return setStatus(agentId, AgentStatus.ARCHIVED);
    }

    private AgentDocument create(String projectId, String ownerId, AgentType type) {
        Instant now = clock.instant();
        AgentDocument agent = new AgentDocument();
        agent.setAgentId(UUID.randomUUID().toString());
        agent.setProjectId(projectId);
        agent.setOwnerId(ownerId);
        agent.setAgentType(type);
        agent.setStatus(AgentStatus.ACTIVE);
        agent.setCreatedAt(now);
        agent.setUpdatedAt(now);
        return agentRepository.save(agent);
    }
}
