package com.keelsystems.mailbox.signal;

import java.io.IOException;
import java.nio.channels.SelectableChannel;

/**
 * Suspend/resume capability of an event loop, as seen by a {@link ReactorWaker}.
 *
 * <p>Implementations suspend the calling task (not necessarily its thread)
 * until the given channel is readable, then resume it.
 */
@FunctionalInterface
public interface Reactor {

    /**
     * Suspends the current task until {@code channel} is readable.
     *
     * @param channel a non-blocking channel
     * @throws IOException if the channel is closed or cannot be watched
     * @throws InterruptedException if the task is interrupted while suspended
     */
    void awaitReadable(SelectableChannel channel) throws IOException, InterruptedException;
}
