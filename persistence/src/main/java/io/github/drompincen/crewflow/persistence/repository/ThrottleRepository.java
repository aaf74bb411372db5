package io.github.drompincen.crewflow.persistence.repository;

import io.github.drompincen.crewflow.persistence.document.ThrottleDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ThrottleRepository extends MongoRepository<ThrottleDocument, String> {
}
