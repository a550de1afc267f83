package com.keelsystems.mailbox.signal;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wait/wake capability a mailbox uses to park its consumer while the queue has
 * nothing to offer. One instance belongs to exactly one mailbox.
 *
 * <p>{@link #await(Lock)} is called with the mailbox lock held and returns with
 * it held again. While suspended the lock is released, and a {@link #signal()}
 * issued after the caller last inspected the queue is never lost.
 */
public interface SignalBackend {

    /**
     * Suspends the caller until {@link #signal()} is called or the backend dies.
     * Spurious returns are allowed; callers re-check their condition in a loop.
     *
     * @param guard the mailbox lock, held by the caller on entry
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws DeadWakerException if the backend can no longer wake anyone
     */
    void await(Lock guard) throws InterruptedException, DeadWakerException;

    /**
     * Wakes the waiter, if any. May be called from any thread.
     *
     * @throws DeadWakerException if the waiter's wakeup resource is permanently gone
     */
    void signal() throws DeadWakerException;

    /**
     * Releases resources held by this backend and wakes any waiter. Idempotent.
     */
    void cleanup();

    /**
     * Creates a backend bound to the lock of the mailbox that will own it.
     */
    @FunctionalInterface
    interface Factory {

        /**
         * @param lock the owning mailbox's lock
         * @return a new backend
         */
        SignalBackend create(ReentrantLock lock);
    }
}
