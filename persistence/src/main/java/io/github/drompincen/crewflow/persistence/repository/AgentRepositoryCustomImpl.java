package io.github.drompincen.crewflow.persistence.repository;

import io.github.drompincen.crewflow.persistence.document.AgentDocument;
import io.github.drompincen.crewflow.protocol.api.AgentStatus;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;

public class AgentRepositoryCustomImpl implements AgentRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public AgentRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<AgentDocument> findDueAgents(Instant cutoff, int limit) {
        Query query = new Query()
                .addCriteria(Criteria.where("status").is(AgentStatus.ACTIVE))
                .addCriteria(new Criteria().orOperator(
                        Criteria.where("lastRunAt").is(null),
                        Criteria.where("lastRunAt").lt(cutoff)))
                .with(Sort.by(Sort.Direction.ASC, "lastRunAt"))
                .limit(limit);
        return mongoTemplate.find(query, AgentDocument.class);
    }

    @Override
    public boolean claimDueRun(String agentId, Instant observedLastRunAt, Instant claimedAt) {
        Query query = new Query()
                .addCriteria(Criteria.where("_id").is(agentId))
                .addCriteria(Criteria.where("status").is(AgentStatus.ACTIVE))
                .addCriteria(Criteria.where("lastRunAt").is(observedLastRunAt));
        Update update = new Update()
                .set("lastRunAt", claimedAt)
                .set("updatedAt", claimedAt)
                .inc("version", 1);
        return mongoTemplate.updateFirst(query, update, AgentDocument.class).getModifiedCount() > 0;
    }
}
