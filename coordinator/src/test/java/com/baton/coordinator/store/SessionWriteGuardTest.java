package com.baton.coordinator.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SessionWriteGuardTest {

    @Mock PlatformTransactionManager transactionManager;

    @Test
    void nestedCallsOnOneSession_reenterTheSameLock() {
        SessionWriteGuard guard = new SessionWriteGuard(transactionManager);

        String result = guard.inTransaction("run-1", () -> guard.inTransaction("run-1", () -> "inner"));

        assertThat(result).isEqualTo("inner");
        assertThat(guard.lockCount()).isEqualTo(1);
        verify(transactionManager, times(2)).getTransaction(any());
    }

    @Test
    void lockMap_holdsOneLockPerSessionEverWritten() {
        SessionWriteGuard guard = new SessionWriteGuard(transactionManager);

        for (int i = 0; i < 3; i++) {
            guard.run("run-1", () -> { });
            guard.run("run-2", () -> { });
        }

        assertThat(guard.lockCount()).isEqualTo(2);
    }
}
