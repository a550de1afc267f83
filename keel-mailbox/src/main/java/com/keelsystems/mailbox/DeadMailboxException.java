package com.keelsystems.mailbox;

/**
 * Thrown when receiving from a mailbox that has already been shut down.
 */
public class DeadMailboxException extends MailboxException {

    public DeadMailboxException(String mailboxName) {
        super("attempted to receive from a dead mailbox: " + mailboxName, mailboxName);
    }
}
