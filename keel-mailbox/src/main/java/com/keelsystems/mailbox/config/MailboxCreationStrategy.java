package com.keelsystems.mailbox.config;

import com.keelsystems.config.MailboxConfig;
import com.keelsystems.mailbox.Mailbox;

/**
 * Strategy interface for creating mailboxes for one signaling mode.
 * This allows mailbox creation strategies to be plugged in without modifying
 * the provider logic.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface MailboxCreationStrategy<M> {

    /**
     * Creates a mailbox according to this strategy.
     *
     * @param name   The mailbox name
     * @param config The mailbox configuration
     * @return A new mailbox instance
     */
    Mailbox<M> createMailbox(String name, MailboxConfig config);
}
