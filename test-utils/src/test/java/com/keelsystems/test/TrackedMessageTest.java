package com.keelsystems.test;

import com.keelsystems.mailbox.Mailbox;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrackedMessageTest {

    @Test
    void testCountsCleanups() {
        TrackedMessage message = new TrackedMessage("x");
        assertFalse(message.isCleanedUp());

        message.cleanup();
        message.cleanup();

        assertEquals(2, message.cleanupCount());
        assertEquals("x", message.tag());
        assertEquals("TrackedMessage[x]", message.toString());
    }

    @Test
    void testRepeatedShutdownCleansOnce() throws InterruptedException {
        Mailbox<TrackedMessage> mailbox = Mailbox.threaded("tracked");
        TrackedMessage received = new TrackedMessage("received");
        TrackedMessage pending = new TrackedMessage("pending");
        mailbox.push(received);
        mailbox.push(pending);

        assertSame(received, mailbox.receive().payload());
        mailbox.shutdown();
        mailbox.shutdown();

        assertFalse(received.isCleanedUp());
        assertEquals(1, pending.cleanupCount());
    }
}
