package com.keelsystems.mailbox.signal;

/**
 * Thrown when a waker's underlying readiness resource is permanently gone,
 * typically because the task that owned it has already torn down.
 */
public class DeadWakerException extends Exception {

    public DeadWakerException(String message) {
        super(message);
    }

    public DeadWakerException(String message, Throwable cause) {
        super(message, cause);
    }
}
