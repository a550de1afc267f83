package com.keelsystems.config;

import java.util.Objects;

/**
 * Configuration for actor mailbox settings.
 * Mailboxes are always unbounded; the configuration selects how the consumer is woken.
 */
public class MailboxConfig {
    // Default values for mailbox configuration
    public static final SignalingMode DEFAULT_SIGNALING_MODE = SignalingMode.THREAD;
    public static final String DEFAULT_NAME_PREFIX = "mailbox";

    private SignalingMode signalingMode;
    private String namePrefix;

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.signalingMode = DEFAULT_SIGNALING_MODE;
        this.namePrefix = DEFAULT_NAME_PREFIX;
    }

    /**
     * Sets the signaling mode used by mailboxes created from this configuration.
     *
     * @param signalingMode THREAD or REACTOR
     * @return This MailboxConfig instance
     */
    public MailboxConfig setSignalingMode(SignalingMode signalingMode) {
        this.signalingMode = Objects.requireNonNull(signalingMode, "signalingMode cannot be null");
        return this;
    }

    /**
     * Gets the signaling mode.
     *
     * @return The signaling mode
     */
    public SignalingMode getSignalingMode() {
        return signalingMode;
    }

    /**
     * Sets the prefix used when naming mailboxes, as in {@code prefix:owner}.
     *
     * @param namePrefix The name prefix
     * @return This MailboxConfig instance
     */
    public MailboxConfig setNamePrefix(String namePrefix) {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix cannot be null");
        return this;
    }

    /**
     * Gets the mailbox name prefix.
     *
     * @return The name prefix
     */
    public String getNamePrefix() {
        return namePrefix;
    }

    /**
     * Builds the mailbox name for the given owner.
     *
     * @param owner the id of the actor owning the mailbox
     * @return the mailbox name
     */
    public String mailboxName(String owner) {
        return namePrefix + ":" + owner;
    }

    /**
     * Determines if this configuration uses reactor signaling.
     *
     * @return true if signalingMode is REACTOR
     */
    public boolean isReactorMode() {
        return signalingMode == SignalingMode.REACTOR;
    }

    @Override
    public String toString() {
        return "MailboxConfig{signalingMode=" + signalingMode + ", namePrefix='" + namePrefix + "'}";
    }
}
