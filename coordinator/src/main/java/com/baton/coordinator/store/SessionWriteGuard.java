package com.baton.coordinator.store;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One logical writer per session.
 *
 * Every mutation runs inside {@link #inTransaction}: the session's lock is
 * taken first and released only after the transaction has committed, so a
 * second writer always reads the first writer's result. Calls nest: an inner
 * call on the same thread re-enters the lock and joins the outer transaction.
 *
 * Writers on different sessions never wait for each other. Unique constraints
 * in the schema remain the backstop across processes.
 *
 * Locks are kept for the life of the process, one per session ever written,
 * closed sessions included. A lock is never evicted: a thread may already be
 * queued on it, and a fresh lock for the same session would let two writers in.
 */
@Component
public class SessionWriteGuard {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final TransactionTemplate tx;

    public SessionWriteGuard(PlatformTransactionManager transactionManager) {
        this.tx = new TransactionTemplate(transactionManager);
    }

    public <T> T inTransaction(String sessionId, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
        lock.lock();
        try {
            return tx.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    /** Number of sessions that have a lock. */
    int lockCount() {
        return locks.size();
    }

    public void run(String sessionId, Runnable work) {
        inTransaction(sessionId, () -> {
            work.run();
            return null;
        });
    }
}
