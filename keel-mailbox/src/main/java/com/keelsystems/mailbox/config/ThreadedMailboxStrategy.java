package com.keelsystems.mailbox.config;

import com.keelsystems.config.MailboxConfig;
import com.keelsystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mailbox creation strategy for actors that own a thread.
 * The consumer blocks on a condition of the mailbox lock.
 *
 * @param <M> The message type
 */
public class ThreadedMailboxStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(ThreadedMailboxStrategy.class);

    @Override
    public Mailbox<M> createMailbox(String name, MailboxConfig config) {
        logger.debug("Creating threaded mailbox {}", name);
        return Mailbox.threaded(name);
    }
}
