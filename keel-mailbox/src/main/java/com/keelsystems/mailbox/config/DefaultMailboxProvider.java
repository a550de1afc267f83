package com.keelsystems.mailbox.config;

import com.keelsystems.config.MailboxConfig;
import com.keelsystems.config.SignalingMode;
import com.keelsystems.mailbox.Mailbox;
import com.keelsystems.mailbox.signal.Reactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Default mailbox provider that picks a creation strategy by signaling mode
 * using the Strategy pattern.
 *
 * - THREAD: mailbox backed by a lock condition
 * - REACTOR: mailbox backed by a reactor waker
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<SignalingMode, MailboxCreationStrategy<M>> strategies;

    public DefaultMailboxProvider() {
        this(new ReactorMailboxStrategy<M>());
    }

    /**
     * Creates a provider whose reactor mailboxes are suspended through the supplied reactors.
     *
     * @param reactors called once per reactor mailbox; may return the same reactor for
     *                 mailboxes consumed on one event-loop thread
     */
    public DefaultMailboxProvider(Supplier<? extends Reactor> reactors) {
        this(new ReactorMailboxStrategy<M>(Objects.requireNonNull(reactors, "reactors cannot be null")));
    }

    private DefaultMailboxProvider(MailboxCreationStrategy<M> reactorStrategy) {
        this.strategies = new EnumMap<>(SignalingMode.class);
        this.strategies.put(SignalingMode.THREAD, new ThreadedMailboxStrategy<>());
        this.strategies.put(SignalingMode.REACTOR, reactorStrategy);
    }

    @Override
    public Mailbox<M> createMailbox(String owner, MailboxConfig config) {
        Objects.requireNonNull(owner, "owner cannot be null");
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();

        logger.debug("DefaultMailboxProvider creating mailbox - owner: {}, config: {}", owner, effectiveConfig);

        MailboxCreationStrategy<M> strategy = strategies.get(effectiveConfig.getSignalingMode());
        return strategy.createMailbox(effectiveConfig.mailboxName(owner), effectiveConfig);
    }
}
