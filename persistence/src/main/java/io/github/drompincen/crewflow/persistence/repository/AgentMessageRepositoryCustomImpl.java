package io.github.drompincen.crewflow.persistence.repository;

import io.github.drompincen.crewflow.persistence.document.AgentMessageDocument;
import io.github.drompincen.crewflow.protocol.api.MessageStatus;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Collection;

public class AgentMessageRepositoryCustomImpl implements AgentMessageRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public AgentMessageRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public long acknowledge(String agentId, Collection<String> messageIds, Instant readAt) {
        if (messageIds.isEmpty()) return 0;

        Query direct = new Query()
                .addCriteria(Criteria.where("_id").in(messageIds))
                .addCriteria(Criteria.where("toAgentId").is(agentId))
                .addCriteria(Criteria.where("status").is(MessageStatus.PENDING));
        Update acknowledged = new Update()
                .set("status", MessageStatus.ACKNOWLEDGED)
                .set("readAt", readAt);
        long changed = mongoTemplate.updateMulti(direct, acknowledged, AgentMessageDocument.class).getModifiedCount();

        Query broadcast = new Query()
                .addCriteria(Criteria.where("_id").in(messageIds))
                .addCriteria(Criteria.where("toAgentId").is(null));
        Update seen = new Update().addToSet("readBy", agentId);
        changed += mongoTemplate.updateMulti(broadcast, seen, AgentMessageDocument.class).getModifiedCount();
        return changed;
    }
}
