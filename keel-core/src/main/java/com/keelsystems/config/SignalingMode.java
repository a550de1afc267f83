package com.keelsystems.config;

/**
 * How a mailbox consumer waits for new messages.
 */
public enum SignalingMode {
    /**
     * The consumer blocks its OS thread on a condition bound to the mailbox lock.
     * Use for actors that own a dedicated thread.
     */
    THREAD,

    /**
     * The consumer runs as a task inside a reactor and is suspended until a
     * wakeup descriptor becomes readable. Use for actors doing non-blocking I/O.
     */
    REACTOR
}
