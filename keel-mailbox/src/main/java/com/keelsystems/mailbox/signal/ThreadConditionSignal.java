package com.keelsystems.mailbox.signal;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Signal backend for consumers that own an OS thread.
 * Waiting blocks the thread on a {@link Condition} of the mailbox lock, so the
 * unlock-and-park step is atomic. This backend never dies.
 */
public class ThreadConditionSignal implements SignalBackend {

    private final ReentrantLock lock;
    private final Condition messageAvailable;

    public ThreadConditionSignal(ReentrantLock lock) {
        this.lock = lock;
        this.messageAvailable = lock.newCondition();
    }

    @Override
    public void await(Lock guard) throws InterruptedException {
        if (guard != lock) {
            throw new IllegalArgumentException("Condition is bound to a different lock");
        }
        messageAvailable.await();
    }

    @Override
    public void signal() {
        // Callers hold the lock, as Condition.signal requires
        messageAvailable.signal();
    }

    /**
     * Wakes every blocked waiter so it can observe the mailbox's dead flag.
     */
    @Override
    public void cleanup() {
        lock.lock();
        try {
            messageAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
