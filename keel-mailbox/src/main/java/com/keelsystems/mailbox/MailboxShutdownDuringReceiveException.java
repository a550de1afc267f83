package com.keelsystems.mailbox;

/**
 * Thrown to a blocked receiver when the mailbox is shut down while it waits,
 * either by another thread or because its waker died.
 */
public class MailboxShutdownDuringReceiveException extends MailboxException {

    public MailboxShutdownDuringReceiveException(String mailboxName) {
        super("mailbox shutdown called during receive: " + mailboxName, mailboxName);
    }

    public MailboxShutdownDuringReceiveException(String mailboxName, Throwable cause) {
        super("mailbox shutdown called during receive: " + mailboxName, mailboxName, cause);
    }
}
