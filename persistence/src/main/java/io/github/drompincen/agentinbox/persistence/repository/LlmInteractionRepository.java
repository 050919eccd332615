package io.github.drompincen.agentinbox.persistence.repository;

import io.github.drompincen.agentinbox.persistence.document.LlmInteractionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface LlmInteractionRepository extends MongoRepository<LlmInteractionDocument, String> {
    List<LlmInteractionDocument> findByThreadIdOrderByTimestampDesc(String threadId);
    long countByThreadId(String threadId);
    long countByThreadIdAndSuccessFalse(String threadId);
}
