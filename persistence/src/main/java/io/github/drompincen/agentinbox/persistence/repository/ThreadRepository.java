package io.github.drompincen.agentinbox.persistence.repository;

import io.github.drompincen.agentinbox.persistence.document.ThreadDocument;
import io.github.drompincen.agentinbox.protocol.api.ThreadStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ThreadRepository extends MongoRepository<ThreadDocument, String>, ThreadStateUpdater {
    List<ThreadDocument> findByUserIdOrderByLastMessageAtDesc(String userId);
    List<ThreadDocument> findByUserIdAndStatusNotOrderByLastMessageAtDesc(String userId, ThreadStatus status);
}
