package com.keelsystems.mailbox.config;

import com.keelsystems.config.MailboxConfig;
import com.keelsystems.mailbox.Mailbox;
import com.keelsystems.mailbox.signal.Reactor;
import com.keelsystems.mailbox.signal.ReactorWaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Mailbox creation strategy for actors running as reactor tasks.
 * Each mailbox gets its own {@link ReactorWaker}. The supplier is asked for a
 * reactor once per mailbox and may hand the same reactor to mailboxes whose
 * consumers run on one event-loop thread. Without a supplier, every waker
 * gets a private selector reactor that dies with the mailbox.
 *
 * @param <M> The message type
 */
public class ReactorMailboxStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(ReactorMailboxStrategy.class);

    private final Supplier<? extends Reactor> reactors;

    public ReactorMailboxStrategy() {
        this(null);
    }

    /**
     * @param reactors supplies the reactor for each new mailbox, or null for private reactors
     */
    public ReactorMailboxStrategy(Supplier<? extends Reactor> reactors) {
        this.reactors = reactors;
    }

    @Override
    public Mailbox<M> createMailbox(String name, MailboxConfig config) {
        ReactorWaker waker;
        if (reactors != null) {
            waker = new ReactorWaker(reactors.get());
        } else {
            waker = ReactorWaker.withOwnReactor();
        }
        logger.debug("Creating reactor mailbox {} (supplied reactor: {})", name, reactors != null);
        return Mailbox.reactive(name, waker);
    }
}
