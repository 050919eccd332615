package io.github.drompincen.agentinbox.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Marks a thread as having a turn in flight. Keyed by thread id so a second insert fails;
 * Mongo reaps the row once {@code expiresAt} passes.
 */
@Document(collection = "turn_locks")
public class TurnLockDocument {

    @Id
    private String threadId;
    private String owner;

    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;
    private Instant acquiredAt;

    public TurnLockDocument() {}

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }

    public Instant getAcquiredAt() { return acquiredAt; }
    public void setAcquiredAt(Instant acquiredAt) { this.acquiredAt = acquiredAt; }
}
