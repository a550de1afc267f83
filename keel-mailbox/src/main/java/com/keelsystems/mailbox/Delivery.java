package com.keelsystems.mailbox;

import java.util.Objects;

/**
 * Outcome of {@link Mailbox#receive}: either an ordinary message or a system
 * event that pre-empted the receive.
 *
 * <p>This is a sealed interface with two possible outcomes:
 * <ul>
 *   <li>{@link Delivered} - an ordinary message matching the receive filter</li>
 *   <li>{@link Interrupted} - a system event, returned regardless of the filter</li>
 * </ul>
 *
 * @param <M> The type of ordinary messages
 */
public sealed interface Delivery<M> {

    /**
     * An ordinary message.
     *
     * @param message the received message
     */
    record Delivered<M>(M message) implements Delivery<M> {
        public Delivered {
            Objects.requireNonNull(message, "Message cannot be null");
        }
    }

    /**
     * A system event that interrupted the receive.
     *
     * @param event the system event
     */
    record Interrupted<M>(SystemEvent event) implements Delivery<M> {
        public Interrupted {
            Objects.requireNonNull(event, "Event cannot be null");
        }
    }

    static <M> Delivery<M> delivered(M message) {
        return new Delivered<>(message);
    }

    static <M> Delivery<M> interrupted(SystemEvent event) {
        return new Interrupted<>(event);
    }

    /**
     * @return true if this is an {@link Interrupted} outcome
     */
    default boolean isInterrupted() {
        return this instanceof Interrupted;
    }

    /**
     * Returns the queued object itself: the message or the system event.
     *
     * @return the payload
     */
    default Object payload() {
        if (this instanceof Delivered<M> delivered) {
            return delivered.message();
        }
        return ((Interrupted<M>) this).event();
    }
}
