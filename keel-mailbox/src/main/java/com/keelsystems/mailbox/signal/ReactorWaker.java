package com.keelsystems.mailbox.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.Pipe;
import java.util.concurrent.locks.Lock;

/**
 * Signal backend for consumers running as tasks inside a {@link Reactor}.
 *
 * <p>The wakeup descriptor is a {@link Pipe}: {@link #signal()} writes one byte
 * to the sink, and {@link #await(Lock)} suspends the task until the source is
 * readable, then drains it. Pending bytes stay in the pipe, so a signal sent
 * while nobody waits is seen by the next wait.
 *
 * <p>The waker dies when it is cleaned up, when its sink has been closed, or
 * when its reactor goes away under a suspended task. From then on both
 * {@code signal} and {@code await} fail with {@link DeadWakerException}.
 *
 * <p>At most one task may be suspended on a waker at a time.
 */
public class ReactorWaker implements SignalBackend {
    private static final Logger logger = LoggerFactory.getLogger(ReactorWaker.class);

    private static final int DRAIN_BUFFER_SIZE = 64;

    private final Reactor reactor;
    private final Closeable ownedReactor;
    private final Pipe.SourceChannel source;
    private final Pipe.SinkChannel sink;
    private final ByteBuffer drainBuffer = ByteBuffer.allocate(DRAIN_BUFFER_SIZE);

    // Guards waiting/closed; the source is closed by whichever side leaves last
    private final Object stateLock = new Object();
    private boolean waiting = false;
    private boolean closed = false;

    /**
     * Creates a waker suspended through the given reactor. The reactor is not
     * closed by {@link #cleanup()}.
     *
     * @param reactor the reactor running the consumer task
     */
    public ReactorWaker(Reactor reactor) {
        this(reactor, null);
    }

    private ReactorWaker(Reactor reactor, Closeable ownedReactor) {
        if (reactor == null) {
            throw new NullPointerException("Reactor cannot be null");
        }
        this.reactor = reactor;
        this.ownedReactor = ownedReactor;
        try {
            Pipe pipe = Pipe.open();
            this.source = pipe.source();
            this.sink = pipe.sink();
            source.configureBlocking(false);
            sink.configureBlocking(false);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open waker pipe", e);
        }
    }

    /**
     * Creates a waker with a private {@link SelectorReactor} that is closed
     * together with the waker.
     *
     * @return a new waker owning its reactor
     */
    public static ReactorWaker withOwnReactor() {
        SelectorReactor reactor = new SelectorReactor();
        return new ReactorWaker(reactor, reactor);
    }

    @Override
    public void signal() throws DeadWakerException {
        if (isDead()) {
            throw new DeadWakerException("Waker has been cleaned up");
        }
        try {
            // A full pipe already guarantees a wakeup, so a zero-byte write is fine
            sink.write(ByteBuffer.wrap(new byte[]{1}));
        } catch (ClosedChannelException e) {
            throw new DeadWakerException("Waker pipe is closed", e);
        } catch (IOException e) {
            throw new DeadWakerException("Failed to signal waker", e);
        }
    }

    /**
     * Suspends the calling task until signaled. A waker serves a single
     * consumer, so a second task trying to suspend while one is already
     * suspended is rejected.
     *
     * @throws IllegalStateException if another task is already suspended on this waker
     */
    @Override
    public void await(Lock guard) throws InterruptedException, DeadWakerException {
        synchronized (stateLock) {
            if (closed) {
                throw new DeadWakerException("Waker has been cleaned up");
            }
            if (waiting) {
                throw new IllegalStateException("Another task is already suspended on this waker");
            }
            waiting = true;
        }
        guard.unlock();
        try {
            reactor.awaitReadable(source);
            drain();
        } catch (ClosedChannelException e) {
            throw new DeadWakerException("Waker pipe closed while suspended", e);
        } catch (ClosedSelectorException e) {
            logger.debug("Reactor closed under a suspended task, killing waker");
            cleanup();
            throw new DeadWakerException("Reactor closed while suspended", e);
        } catch (IOException e) {
            logger.debug("Reactor failed to suspend on waker: {}", e.getMessage());
            cleanup();
            throw new DeadWakerException("Failed to wait on waker", e);
        } finally {
            leave();
            guard.lock();
        }
    }

    private void drain() throws IOException, DeadWakerException {
        synchronized (drainBuffer) {
            int read;
            do {
                drainBuffer.clear();
                read = source.read(drainBuffer);
            } while (read > 0);
            if (read < 0) {
                throw new DeadWakerException("Waker sink closed");
            }
        }
    }

    private void leave() {
        synchronized (stateLock) {
            waiting = false;
            if (closed) {
                closeQuietly(source);
            }
        }
    }

    @Override
    public void cleanup() {
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        // Closing the sink makes the source readable (end of stream), waking a suspended task
        closeQuietly(sink);
        synchronized (stateLock) {
            if (!waiting) {
                closeQuietly(source);
            }
        }
        if (ownedReactor != null) {
            closeQuietly(ownedReactor);
        }
    }

    /**
     * @return true once the waker can no longer deliver wakeups
     */
    public boolean isDead() {
        synchronized (stateLock) {
            return closed;
        }
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            logger.debug("Error closing waker resource {}: {}", closeable, e.getMessage());
        }
    }
}
