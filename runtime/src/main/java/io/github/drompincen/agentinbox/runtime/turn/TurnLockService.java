package io.github.drompincen.agentinbox.runtime.turn;

import io.github.drompincen.agentinbox.persistence.document.TurnLockDocument;
import io.github.drompincen.agentinbox.persistence.repository.TurnLockRepository;
import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Persisted per-thread turn lock. The lock row is keyed by thread id, so acquiring is a plain
 * insert that fails while another owner holds it.
 */
@Service
public class TurnLockService {

    private static final Logger log = LoggerFactory.getLogger(TurnLockService.class);

    private final TurnLockRepository lockRepository;
    private final long ttlSeconds;

    public TurnLockService(TurnLockRepository lockRepository, InboxProperties properties) {
        this.lockRepository = lockRepository;
        this.ttlSeconds = properties.getTurn().getLockTtlSeconds();
    }

    public Optional<String> tryAcquire(String threadId) {
        var existing = lockRepository.findById(threadId);
        if (existing.isPresent()) {
            if (existing.get().getExpiresAt().isAfter(Instant.now())) {
                return Optional.empty();
            }
            // Mongo's TTL monitor runs about once a minute, so an expired row may still be there.
            lockRepository.delete(existing.get());
        }

        String owner = UUID.randomUUID().toString();
        TurnLockDocument lock = new TurnLockDocument();
        lock.setThreadId(threadId);
        lock.setOwner(owner);
        lock.setAcquiredAt(Instant.now());
        lock.setExpiresAt(Instant.now().plusSeconds(ttlSeconds));
        try {
            lockRepository.insert(lock);
            return Optional.of(owner);
        } catch (DuplicateKeyException e) {
            log.debug("Lost turn lock race for thread {}", threadId);
            return Optional.empty();
        }
    }

    public void release(String threadId, String owner) {
        lockRepository.findById(threadId)
                .filter(l -> l.getOwner().equals(owner))
                .ifPresent(lockRepository::delete);
    }

    public boolean isLocked(String threadId) {
        return lockRepository.findById(threadId)
                .filter(l -> l.getExpiresAt().isAfter(Instant.now()))
                .isPresent();
    }
}
