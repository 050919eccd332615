package io.github.drompincen.agentinbox.persistence.repository;

import io.github.drompincen.agentinbox.persistence.document.ApprovalDocument;
import io.github.drompincen.agentinbox.protocol.api.ApprovalStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ApprovalRepository extends MongoRepository<ApprovalDocument, String>, ApprovalTransitions {
    List<ApprovalDocument> findByThreadIdAndStatus(String threadId, ApprovalStatus status);
    List<ApprovalDocument> findByUserIdAndStatusOrderByCreatedAtDesc(String userId, ApprovalStatus status);
    void deleteByThreadId(String threadId);
}
