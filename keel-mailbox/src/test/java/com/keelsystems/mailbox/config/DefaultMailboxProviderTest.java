package com.keelsystems.mailbox.config;

import com.keelsystems.config.MailboxConfig;
import com.keelsystems.config.SignalingMode;
import com.keelsystems.mailbox.Delivery;
import com.keelsystems.mailbox.Mailbox;
import com.keelsystems.mailbox.signal.SelectorReactor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class DefaultMailboxProviderTest {

    @Test
    void testNullConfigUsesDefaults() throws InterruptedException {
        DefaultMailboxProvider<String> provider = new DefaultMailboxProvider<>();

        Mailbox<String> mailbox = provider.createMailbox("actor-1", null);
        mailbox.push("hello");

        assertEquals("mailbox:actor-1", mailbox.getName());
        assertEquals("hello", mailbox.receive().payload());
        mailbox.shutdown();
    }

    @Test
    @Timeout(5)
    void testReactorModeMailboxWakesAcrossThreads() throws Exception {
        DefaultMailboxProvider<String> provider = new DefaultMailboxProvider<>();
        MailboxConfig config = new MailboxConfig()
                .setSignalingMode(SignalingMode.REACTOR)
                .setNamePrefix("io");
        Mailbox<String> mailbox = provider.createMailbox("socket-reader", config);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        Future<Delivery<String>> future = executor.submit(() -> mailbox.receive());
        Thread.sleep(50);
        mailbox.push("bytes");

        assertEquals("io:socket-reader", mailbox.getName());
        assertEquals("bytes", future.get(2, TimeUnit.SECONDS).payload());

        mailbox.shutdown();
        executor.shutdown();
        executor.awaitTermination(1, TimeUnit.SECONDS);
    }

    @Test
    void testReactorSupplierIsUsedPerMailbox() throws Exception {
        List<SelectorReactor> reactors = new ArrayList<>();
        DefaultMailboxProvider<String> provider = new DefaultMailboxProvider<>(() -> {
            SelectorReactor reactor = new SelectorReactor();
            reactors.add(reactor);
            return reactor;
        });
        MailboxConfig config = new MailboxConfig().setSignalingMode(SignalingMode.REACTOR);

        Mailbox<String> first = provider.createMailbox("a", config);
        Mailbox<String> second = provider.createMailbox("b", config);
        provider.createMailbox("c", new MailboxConfig()).shutdown();

        assertEquals(2, reactors.size());

        first.shutdown();
        second.shutdown();
        // Supplied reactors belong to the caller and stay open
        for (SelectorReactor reactor : reactors) {
            assertTrue(reactor.isOpen());
            reactor.close();
        }
    }

    @Test
    @Timeout(5)
    void testOneReactorServesMailboxesOfOneEventLoopThread() throws Exception {
        SelectorReactor reactor = new SelectorReactor();
        DefaultMailboxProvider<String> provider = new DefaultMailboxProvider<>(() -> reactor);
        MailboxConfig config = new MailboxConfig().setSignalingMode(SignalingMode.REACTOR);
        Mailbox<String> requests = provider.createMailbox("requests", config);
        Mailbox<String> replies = provider.createMailbox("replies", config);
        ExecutorService eventLoop = Executors.newSingleThreadExecutor();

        Future<String> first = eventLoop.submit(() -> requests.receive().payload() + "/" + replies.receive().payload());
        Thread.sleep(50);
        requests.push("ping");
        Thread.sleep(50);
        replies.push("pong");
        assertEquals("ping/pong", first.get(2, TimeUnit.SECONDS));

        requests.shutdown();
        assertTrue(reactor.isOpen());

        Future<Delivery<String>> second = eventLoop.submit(() -> replies.receive());
        Thread.sleep(50);
        replies.push("again");
        assertEquals("again", second.get(2, TimeUnit.SECONDS).payload());

        replies.shutdown();
        reactor.close();
        eventLoop.shutdown();
        eventLoop.awaitTermination(1, TimeUnit.SECONDS);
    }

    @Test
    void testRejectsNullOwner() {
        DefaultMailboxProvider<String> provider = new DefaultMailboxProvider<>();
        assertThrows(NullPointerException.class, () -> provider.createMailbox(null, null));
    }
}
