package com.keelsystems.mailbox.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;

/**
 * Per-actor reactor built on a NIO {@link Selector}.
 *
 * <p>A suspended task parks its thread in {@link Selector#select()} until the
 * watched channel becomes readable. The channel is registered only for the
 * duration of one wait. Closing the reactor wakes a suspended task, which then
 * fails with {@link ClosedSelectorException}.
 *
 * <p>The reactor belongs to one event-loop thread. Several wakers may share it
 * as long as their tasks all run on that thread.
 */
public class SelectorReactor implements Reactor, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(SelectorReactor.class);

    private final Selector selector;

    public SelectorReactor() {
        try {
            this.selector = Selector.open();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open selector", e);
        }
    }

    @Override
    public void awaitReadable(SelectableChannel channel) throws IOException, InterruptedException {
        SelectionKey key = channel.register(selector, SelectionKey.OP_READ);
        try {
            while (true) {
                selector.select();
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted while suspended on " + channel);
                }
                if (!selector.isOpen()) {
                    throw new ClosedSelectorException();
                }
                if (!key.isValid()) {
                    throw new ClosedChannelException();
                }
                if (selector.selectedKeys().remove(key)) {
                    return;
                }
            }
        } finally {
            if (selector.isOpen()) {
                key.cancel();
                // Flush the cancelled key so the channel can be registered again or closed
                selector.selectNow();
            }
        }
    }

    /**
     * @return true until {@link #close()} is called
     */
    public boolean isOpen() {
        return selector.isOpen();
    }

    @Override
    public void close() throws IOException {
        if (selector.isOpen()) {
            logger.debug("Closing selector reactor");
            selector.close();
        }
    }
}
