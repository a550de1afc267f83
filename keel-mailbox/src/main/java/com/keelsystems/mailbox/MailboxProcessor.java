package com.keelsystems.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Drives an actor's receive loop over its mailbox on a dedicated thread.
 * Handles system events, handler failures and mailbox death.
 *
 * <p>The loop ends on a {@link TerminationRequest}, on interruption, or when
 * the mailbox dies; the mailbox is shut down on the way out.
 *
 * @param <M> The type of messages in the mailbox
 */
public class MailboxProcessor<M> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    private static final long STOP_JOIN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(1);

    private final String actorId;
    private final Mailbox<M> mailbox;
    private final Consumer<M> messageHandler;
    private final Consumer<SystemEvent> systemEventHandler;
    private final BiConsumer<M, Throwable> exceptionHandler;
    private final ThreadFactory threadFactory;

    private volatile boolean running = false;
    private volatile Thread thread;
    private final CountDownLatch stopped = new CountDownLatch(1);

    /**
     * Creates a new mailbox processor that runs on a daemon platform thread.
     *
     * @param actorId            The ID of the actor for logging
     * @param mailbox            The mailbox to receive from
     * @param messageHandler     Handles ordinary messages
     * @param systemEventHandler Handles system events other than termination requests
     * @param exceptionHandler   Receives message handler failures
     */
    public MailboxProcessor(
            String actorId,
            Mailbox<M> mailbox,
            Consumer<M> messageHandler,
            Consumer<SystemEvent> systemEventHandler,
            BiConsumer<M, Throwable> exceptionHandler) {
        this(actorId, mailbox, messageHandler, systemEventHandler, exceptionHandler, null);
    }

    /**
     * Creates a new mailbox processor with a thread factory.
     *
     * @param actorId            The ID of the actor for logging
     * @param mailbox            The mailbox to receive from
     * @param messageHandler     Handles ordinary messages
     * @param systemEventHandler Handles system events other than termination requests
     * @param exceptionHandler   Receives message handler failures
     * @param threadFactory      The thread factory, or null for a named daemon thread
     */
    public MailboxProcessor(
            String actorId,
            Mailbox<M> mailbox,
            Consumer<M> messageHandler,
            Consumer<SystemEvent> systemEventHandler,
            BiConsumer<M, Throwable> exceptionHandler,
            ThreadFactory threadFactory) {
        this.actorId = Objects.requireNonNull(actorId, "actorId cannot be null");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox cannot be null");
        this.messageHandler = Objects.requireNonNull(messageHandler, "messageHandler cannot be null");
        this.systemEventHandler = Objects.requireNonNull(systemEventHandler, "systemEventHandler cannot be null");
        this.exceptionHandler = Objects.requireNonNull(exceptionHandler, "exceptionHandler cannot be null");
        this.threadFactory = threadFactory;
    }

    /**
     * Starts the receive loop. Calling start on a running processor has no effect.
     */
    public synchronized void start() {
        if (running) {
            logger.debug("Actor {} mailbox already running", actorId);
            return;
        }
        if (stopped.getCount() == 0) {
            throw new IllegalStateException("Actor " + actorId + " has already stopped");
        }
        running = true;
        logger.info("Starting actor {} mailbox", actorId);

        if (threadFactory != null) {
            thread = threadFactory.newThread(this::processMailboxLoop);
        } else {
            thread = new Thread(this::processMailboxLoop, "actor-" + actorId);
            thread.setDaemon(true);
        }
        thread.start();
    }

    /**
     * Requests termination and waits briefly for the loop to finish.
     * Messages still queued are cleaned up when the mailbox shuts down.
     */
    public void stop() {
        if (!running) {
            return;
        }
        logger.debug("Stopping actor {} mailbox", actorId);
        mailbox.pushSystemEvent(new TerminationRequest("stop"));
        Thread current = thread;
        if (current != null && Thread.currentThread() != current) {
            try {
                if (!stopped.await(STOP_JOIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    logger.warn("Actor {} did not stop within timeout, interrupting", actorId);
                    current.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Delivers a message to the mailbox.
     *
     * @param message The message to enqueue
     * @throws DeadRecipientException if the actor's mailbox is dead
     */
    public void tell(M message) {
        mailbox.push(message);
    }

    /**
     * Returns true while the receive loop is running.
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * Waits for the receive loop to finish.
     *
     * @param timeout how long to wait
     * @param unit the time unit of the timeout argument
     * @return true if the loop finished within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    private void processMailboxLoop() {
        try {
            while (running) {
                Delivery<M> delivery = mailbox.receive();
                if (delivery instanceof Delivery.Delivered<M> delivered) {
                    handleMessage(delivered.message());
                } else {
                    SystemEvent event = ((Delivery.Interrupted<M>) delivery).event();
                    if (event instanceof TerminationRequest request) {
                        logger.debug("Actor {} terminating: {}", actorId, request.reason());
                        break;
                    }
                    handleSystemEvent(event);
                }
            }
        } catch (InterruptedException e) {
            logger.debug("Actor {} mailbox interrupted", actorId);
            Thread.currentThread().interrupt();
        } catch (MailboxException e) {
            logger.debug("Actor {} mailbox is gone: {}", actorId, e.getMessage());
        } finally {
            mailbox.shutdown();
            // Same monitor as start(), so a concurrent start sees either running or stopped
            synchronized (this) {
                stopped.countDown();
                running = false;
                thread = null;
            }
            logger.info("Actor {} mailbox stopped", actorId);
        }
    }

    private void handleMessage(M message) {
        try {
            messageHandler.accept(message);
        } catch (Throwable e) {
            logger.error("Actor {} error processing message: {}", actorId, message, e);
            exceptionHandler.accept(message, e);
        }
    }

    private void handleSystemEvent(SystemEvent event) {
        try {
            systemEventHandler.accept(event);
        } catch (RuntimeException e) {
            logger.error("Actor {} error processing system event: {}", actorId, event, e);
        }
    }
}
