package io.github.drompincen.agentinbox.persistence.repository;

import io.github.drompincen.agentinbox.persistence.document.TurnLockDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface TurnLockRepository extends MongoRepository<TurnLockDocument, String> {
}
