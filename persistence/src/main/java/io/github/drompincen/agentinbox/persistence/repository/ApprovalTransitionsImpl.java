package io.github.drompincen.agentinbox.persistence.repository;

import io.github.drompincen.agentinbox.persistence.document.ApprovalDocument;
import io.github.drompincen.agentinbox.protocol.api.ApprovalStatus;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public class ApprovalTransitionsImpl implements ApprovalTransitions {

    private final MongoTemplate mongoTemplate;

    public ApprovalTransitionsImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<ApprovalDocument> resolveIfPending(String approvalId, ApprovalStatus status,
                                                       String resolvedBy, String comment) {
        if (status == ApprovalStatus.PENDING) {
            throw new IllegalArgumentException("Cannot resolve an approval to PENDING");
        }
        Update update = new Update()
                .set("status", status)
                .set("resolvedBy", resolvedBy)
                .set("resolvedAt", Instant.now())
                .set("comment", comment);
        return Optional.ofNullable(mongoTemplate.findAndModify(pending(approvalId), update,
                FindAndModifyOptions.options().returnNew(true), ApprovalDocument.class));
    }

    @Override
    public boolean enqueueIfPending(String approvalId, List<ApprovalDocument.QueuedAction> actions) {
        if (actions.isEmpty()) return true;
        Update update = new Update().push("queuedActions").each(actions.toArray());
        return mongoTemplate.updateFirst(pending(approvalId), update, ApprovalDocument.class)
                .getModifiedCount() == 1;
    }

    private Query pending(String approvalId) {
        return new Query(Criteria.where("_id").is(approvalId).and("status").is(ApprovalStatus.PENDING));
    }
}
