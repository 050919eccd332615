package io.github.drompincen.agentinbox.persistence.repository;

import io.github.drompincen.agentinbox.persistence.document.MessageDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface MessageRepository extends MongoRepository<MessageDocument, String> {
    List<MessageDocument> findByThreadIdOrderBySeqAsc(String threadId);
    List<MessageDocument> findByThreadIdOrderBySeqDesc(String threadId, Pageable pageable);
    Optional<MessageDocument> findTopByThreadIdOrderBySeqDesc(String threadId);
    long countByThreadId(String threadId);
    void deleteByThreadId(String threadId);
}
