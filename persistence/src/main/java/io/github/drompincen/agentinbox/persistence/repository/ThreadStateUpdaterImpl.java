package io.github.drompincen.agentinbox.persistence.repository;

import io.github.drompincen.agentinbox.persistence.document.ThreadDocument;
import io.github.drompincen.agentinbox.protocol.api.ThreadState;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

public class ThreadStateUpdaterImpl implements ThreadStateUpdater {

    private final MongoTemplate mongoTemplate;

    public ThreadStateUpdaterImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean transitionState(String threadId, ThreadState expected, ThreadState next) {
        Query query = new Query(Criteria.where("_id").is(threadId)
                .and("status").is(expected.status())
                .and("pendingApprovalId").is(expected.pendingApprovalId().orElse(null)));
        Update update = new Update()
                .set("status", next.status())
                .set("pendingApprovalId", next.pendingApprovalId().orElse(null))
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, ThreadDocument.class).getModifiedCount() == 1;
    }

    @Override
    public void assignAgent(String threadId, String agentId, String agentName) {
        Update update = new Update()
                .set("agentId", agentId)
                .set("agentName", agentName)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(byId(threadId), update, ThreadDocument.class);
    }

    @Override
    public void recordMessage(String threadId, String preview, Instant at, boolean unread) {
        Update update = new Update()
                .set("preview", preview)
                .set("lastMessageAt", at)
                .set("updatedAt", at)
                .inc("messageCount", 1);
        if (unread) {
            update.inc("unreadCount", 1);
        }
        mongoTemplate.updateFirst(byId(threadId), update, ThreadDocument.class);
    }

    @Override
    public void setUnreadCount(String threadId, int unreadCount) {
        mongoTemplate.updateFirst(byId(threadId), new Update().set("unreadCount", unreadCount), ThreadDocument.class);
    }

    private static Query byId(String threadId) {
        return new Query(Criteria.where("_id").is(threadId));
    }
}
