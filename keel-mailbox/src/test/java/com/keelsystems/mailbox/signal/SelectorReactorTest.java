package com.keelsystems.mailbox.signal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.Pipe;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SelectorReactorTest {

    private static Pipe openPipe() throws Exception {
        Pipe pipe = Pipe.open();
        pipe.source().configureBlocking(false);
        pipe.sink().configureBlocking(false);
        return pipe;
    }

    @Test
    @Timeout(5)
    void testReturnsWhenChannelIsReadable() throws Exception {
        Pipe pipe = openPipe();
        try (SelectorReactor reactor = new SelectorReactor()) {
            pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));

            reactor.awaitReadable(pipe.source());

            // The channel is deregistered after each wait and can be watched again
            pipe.sink().write(ByteBuffer.wrap(new byte[]{1}));
            reactor.awaitReadable(pipe.source());
        } finally {
            pipe.sink().close();
            pipe.source().close();
        }
    }

    @Test
    void testClosedChannelIsRejected() throws Exception {
        Pipe pipe = openPipe();
        pipe.source().close();
        pipe.sink().close();

        try (SelectorReactor reactor = new SelectorReactor()) {
            assertThrows(ClosedChannelException.class, () -> reactor.awaitReadable(pipe.source()));
        }
    }

    @Test
    void testClosedReactorIsRejected() throws Exception {
        Pipe pipe = openPipe();
        SelectorReactor reactor = new SelectorReactor();
        reactor.close();

        assertFalse(reactor.isOpen());
        assertThrows(ClosedSelectorException.class, () -> reactor.awaitReadable(pipe.source()));

        pipe.sink().close();
        pipe.source().close();
    }

    @Test
    @Timeout(5)
    void testInterruptEndsSuspension() throws Exception {
        Pipe pipe = openPipe();
        SelectorReactor reactor = new SelectorReactor();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);

        Thread task = new Thread(() -> {
            started.countDown();
            try {
                reactor.awaitReadable(pipe.source());
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        task.start();
        started.await();
        Thread.sleep(50);
        task.interrupt();
        task.join(1000);

        assertInstanceOf(InterruptedException.class, failure.get());

        reactor.close();
        pipe.sink().close();
        pipe.source().close();
    }
}
