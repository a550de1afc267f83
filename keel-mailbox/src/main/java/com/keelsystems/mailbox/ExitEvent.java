package com.keelsystems.mailbox;

/**
 * Notifies an actor that a linked actor has exited.
 *
 * @param actorId the id of the actor that exited
 * @param reason the failure that ended it, or null for a normal exit
 */
public record ExitEvent(String actorId, Throwable reason) implements SystemEvent {

    /**
     * @return true if the linked actor exited without a failure
     */
    public boolean isNormal() {
        return reason == null;
    }
}
