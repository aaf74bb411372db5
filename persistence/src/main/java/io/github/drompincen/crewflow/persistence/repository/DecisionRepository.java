package io.github.drompincen.crewflow.persistence.repository;

import io.github.drompincen.crewflow.persistence.document.DecisionDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DecisionRepository extends MongoRepository<DecisionDocument, String> {

    List<DecisionDocument> findByProjectIdAndAgentIdOrderByCreatedAtDesc(
            String projectId, String agentId, Pageable pageable);
}
