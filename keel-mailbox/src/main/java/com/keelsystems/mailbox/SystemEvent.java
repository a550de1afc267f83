package com.keelsystems.mailbox;

/**
 * Marker for high-priority control messages.
 *
 * <p>A system event jumps to the head of the mailbox when pushed and is handed
 * to the next {@link Mailbox#receive} call whatever filter that call uses. It
 * surfaces as {@link Delivery.Interrupted} rather than as an ordinary message.
 */
public interface SystemEvent {
}
