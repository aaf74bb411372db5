package io.github.drompincen.crewflow.persistence.repository;

import io.github.drompincen.crewflow.persistence.document.AgentMessageDocument;
import io.github.drompincen.crewflow.protocol.api.MessageStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface AgentMessageRepository extends MongoRepository<AgentMessageDocument, String>, AgentMessageRepositoryCustom {

    List<AgentMessageDocument> findByProjectIdAndToAgentIdAndStatusAndCreatedAtAfter(
            String projectId, String toAgentId, MessageStatus status, Instant after);

    List<AgentMessageDocument> findByProjectIdAndToAgentIdIsNullAndCreatedAtAfter(String projectId, Instant after);

    long deleteByProjectIdAndCreatedAtBefore(String projectId, Instant before);
}
