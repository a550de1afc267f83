package com.keelsystems.mailbox;

/**
 * Thrown to a sender when the receiving mailbox is dead or its consumer can no
 * longer be woken. The recipient should be treated as gone.
 */
public class DeadRecipientException extends MailboxException {

    public DeadRecipientException(String mailboxName) {
        super("dead recipient: " + mailboxName, mailboxName);
    }

    public DeadRecipientException(String mailboxName, Throwable cause) {
        super("dead recipient: " + mailboxName, mailboxName, cause);
    }
}
