package com.keelsystems.mailbox;

/**
 * Asks the actor owning the mailbox to stop its receive loop.
 *
 * @param reason why termination was requested, for logging
 */
public record TerminationRequest(String reason) implements SystemEvent {

    public TerminationRequest() {
        this("requested");
    }
}
