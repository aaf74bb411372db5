package io.github.drompincen.crewflow.persistence.repository;

import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.protocol.api.AgentStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AgentRepository extends MongoRepository<AgentDocument, String>, AgentRepositoryCustom {

    List<AgentDocument> findByProjectIdAndStatusOrderByCreatedAtAsc(String projectId, AgentStatus status);

    List<AgentDocument> findByProjectIdOrderByCreatedAtAsc(String projectId);
}
