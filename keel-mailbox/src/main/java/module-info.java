/**
 * Keel Mailbox Module
 *
 * Actor mailboxes with selective receive and priority system events.
 *
 * Signaling backends:
 * - ThreadConditionSignal: consumer blocks its thread on a lock-bound condition
 * - ReactorWaker: consumer task is suspended by a reactor until a pipe is readable
 *
 * @since 0.1.0
 */
module com.keelsystems.mailbox {
    requires transitive com.keelsystems.core;
    requires org.slf4j;

    exports com.keelsystems.mailbox;
    exports com.keelsystems.mailbox.signal;
    exports com.keelsystems.mailbox.config;
}
