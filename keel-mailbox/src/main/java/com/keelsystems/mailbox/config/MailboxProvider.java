package com.keelsystems.mailbox.config;

import com.keelsystems.config.MailboxConfig;
import com.keelsystems.mailbox.Mailbox;

/**
 * An interface for providing actor mailboxes.
 * Implementations decide how a mailbox's consumer is signaled based on the configuration.
 *
 * @param <M> The type of messages the mailbox will hold.
 */
public interface MailboxProvider<M> {

    /**
     * Creates a mailbox for the given actor.
     *
     * @param owner  The id of the actor that will consume from the mailbox
     * @param config The mailbox configuration, or null for defaults
     * @return A {@link Mailbox} instance suitable for the actor.
     */
    Mailbox<M> createMailbox(String owner, MailboxConfig config);
}
