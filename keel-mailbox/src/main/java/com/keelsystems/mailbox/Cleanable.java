package com.keelsystems.mailbox;

/**
 * Implemented by messages that hold a resource (a reply channel, a buffer, a
 * handle) which must be released if the message is never received.
 * {@link Mailbox#shutdown()} invokes {@link #cleanup()} once for every message
 * still queued.
 */
@FunctionalInterface
public interface Cleanable {

    /**
     * Releases the resources held by this message.
     */
    void cleanup();
}
