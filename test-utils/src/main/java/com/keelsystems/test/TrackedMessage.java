package com.keelsystems.test;

import com.keelsystems.mailbox.Cleanable;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test message that records how many times a mailbox cleaned it up.
 * A correct shutdown cleans each pending message exactly once.
 */
public final class TrackedMessage implements Cleanable {

    private final String tag;
    private final AtomicInteger cleanups = new AtomicInteger();

    public TrackedMessage(String tag) {
        this.tag = tag;
    }

    @Override
    public void cleanup() {
        cleanups.incrementAndGet();
    }

    public String tag() {
        return tag;
    }

    public int cleanupCount() {
        return cleanups.get();
    }

    public boolean isCleanedUp() {
        return cleanups.get() > 0;
    }

    @Override
    public String toString() {
        return "TrackedMessage[" + tag + "]";
    }
}
