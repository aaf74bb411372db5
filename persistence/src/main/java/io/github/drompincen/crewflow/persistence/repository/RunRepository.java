package io.github.drompincen.crewflow.persistence.repository;

import io.github.drompincen.crewflow.persistence.document.RunDocument;
import io.github.drompincen.crewflow.protocol.api.RunStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RunRepository extends MongoRepository<RunDocument, String>, RunRepositoryCustom {

    List<RunDocument> findByStatusAndScheduledAtLessThanEqualOrderByScheduledAtAsc(
            RunStatus status, Instant now, Pageable pageable);

    Optional<RunDocument> findFirstByFunctionIdAndThrottleKeyAndStatusAndStartedAtIsNull(
            String functionId, String throttleKey, RunStatus status);

    List<RunDocument> findByStatusAndLeaseUntilLessThan(RunStatus status, Instant now);
}
