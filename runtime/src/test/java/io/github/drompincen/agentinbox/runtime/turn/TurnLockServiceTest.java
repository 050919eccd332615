package io.github.drompincen.agentinbox.runtime.turn;

import io.github.drompincen.agentinbox.persistence.document.TurnLockDocument;
import io.github.drompincen.agentinbox.persistence.repository.TurnLockRepository;
import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TurnLockServiceTest {

    @Mock
    private TurnLockRepository lockRepository;

    private TurnLockService lockService;

    @BeforeEach
    void setUp() {
        lockService = new TurnLockService(lockRepository, new InboxProperties());
    }

    private TurnLockDocument lock(String owner, Instant expiresAt) {
        TurnLockDocument lock = new TurnLockDocument();
        lock.setThreadId("t1");
        lock.setOwner(owner);
        lock.setExpiresAt(expiresAt);
        return lock;
    }

    @Test
    void tryAcquireSucceedsWhenNoLockExists() {
        when(lockRepository.findById("t1")).thenReturn(Optional.empty());
        when(lockRepository.insert(any(TurnLockDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        Optional<String> owner = lockService.tryAcquire("t1");

        assertThat(owner).isPresent();
        ArgumentCaptor<TurnLockDocument> inserted = ArgumentCaptor.forClass(TurnLockDocument.class);
        verify(lockRepository).insert(inserted.capture());
        assertThat(inserted.getValue().getThreadId()).isEqualTo("t1");
        assertThat(inserted.getValue().getOwner()).isEqualTo(owner.get());
        assertThat(inserted.getValue().getExpiresAt()).isAfter(Instant.now().plusSeconds(250));
    }

    @Test
    void tryAcquireFailsWhenActiveLockExists() {
        when(lockRepository.findById("t1")).thenReturn(Optional.of(lock("other", Instant.now().plusSeconds(30))));

        assertThat(lockService.tryAcquire("t1")).isEmpty();
        verify(lockRepository, never()).insert(any(TurnLockDocument.class));
    }

    @Test
    void tryAcquireReplacesExpiredLock() {
        TurnLockDocument expired = lock("old", Instant.now().minusSeconds(10));
        when(lockRepository.findById("t1")).thenReturn(Optional.of(expired));
        when(lockRepository.insert(any(TurnLockDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(lockService.tryAcquire("t1")).isPresent();
        verify(lockRepository).delete(expired);
    }

    @Test
    void concurrentInsertLosesCleanly() {
        when(lockRepository.findById("t1")).thenReturn(Optional.empty());
        when(lockRepository.insert(any(TurnLockDocument.class))).thenThrow(new DuplicateKeyException("E11000"));

        assertThat(lockService.tryAcquire("t1")).isEmpty();
    }

    @Test
    void releaseOnlyDeletesOwnLock() {
        TurnLockDocument mine = lock("me", Instant.now().plusSeconds(30));
        when(lockRepository.findById("t1")).thenReturn(Optional.of(mine));

        lockService.release("t1", "someone-else");
        verify(lockRepository, never()).delete(any(TurnLockDocument.class));

        lockService.release("t1", "me");
        verify(lockRepository).delete(mine);
    }

    @Test
    void isLockedIgnoresExpiredRows() {
        when(lockRepository.findById("t1")).thenReturn(Optional.of(lock("x", Instant.now().minusSeconds(1))));

        assertThat(lockService.isLocked("t1")).isFalse();
    }
}
