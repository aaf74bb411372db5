package io.github.drompincen.crewflow.persistence.repository;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.crewflow.persistence.document.RunDocument;
import io.github.drompincen.crewflow.protocol.api.RunStatus;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunRepositoryCustomImplTest {

    @Mock MongoTemplate mongoTemplate;

    @Test
    void extendLeaseRequiresRunningRunHeldByOwner() {
        Instant until = Instant.parse("2026-01-01T10:01:00Z");
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(RunDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        boolean extended = new RunRepositoryCustomImpl(mongoTemplate).extendLease("r1", "worker-1", until);

        assertThat(extended).isTrue();
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(RunDocument.class));
        Document filter = query.getValue().getQueryObject();
        assertThat(filter.get("_id")).isEqualTo("r1");
        assertThat(filter.get("status")).isEqualTo(RunStatus.RUNNING);
        assertThat(filter.get("leaseOwner")).isEqualTo("worker-1");
        Document set = update.getValue().getUpdateObject().get("$set", Document.class);
        assertThat(set.get("leaseUntil")).isEqualTo(until);
        assertThat(update.getValue().getUpdateObject().containsKey("$inc")).isFalse();
    }

    @Test
    void lostLeaseReportsFalse() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(RunDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(new RunRepositoryCustomImpl(mongoTemplate).extendLease("r1", "worker-1", Instant.now()))
                .isFalse();
    }
}
