package io.github.drompincen.crewflow.persistence.repository;

import io.github.drompincen.crewflow.persistence.document.RunDocument;
import io.github.drompincen.crewflow.protocol.api.RunStatus;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

public class RunRepositoryCustomImpl implements RunRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public RunRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean extendLease(String runId, String owner, Instant leaseUntil) {
        Query query = new Query()
                .addCriteria(Criteria.where("_id").is(runId))
                .addCriteria(Criteria.where("status").is(RunStatus.RUNNING))
                .addCriteria(Criteria.where("leaseOwner").is(owner));
        Update update = new Update().set("leaseUntil", leaseUntil);
        return mongoTemplate.updateFirst(query, update, RunDocument.class).getModifiedCount() > 0;
    }
}
