package com.keelsystems.mailbox;

/**
 * Base class for failures surfaced by a {@link Mailbox}.
 */
public class MailboxException extends RuntimeException {

    /** The name of the mailbox that failed. */
    private final String mailboxName;

    public MailboxException(String message, String mailboxName) {
        super(message);
        this.mailboxName = mailboxName;
    }

    public MailboxException(String message, String mailboxName, Throwable cause) {
        super(message, cause);
        this.mailboxName = mailboxName;
    }

    /**
     * Returns the name of the mailbox where the exception occurred.
     *
     * @return the mailbox name
     */
    public String getMailboxName() {
        return mailboxName;
    }
}
