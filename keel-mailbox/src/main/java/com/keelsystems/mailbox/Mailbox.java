package com.keelsystems.mailbox;

import com.keelsystems.mailbox.signal.DeadWakerException;
import com.keelsystems.mailbox.signal.ReactorWaker;
import com.keelsystems.mailbox.signal.SignalBackend;
import com.keelsystems.mailbox.signal.ThreadConditionSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Unbounded actor mailbox with selective receive and priority system events.
 *
 * <p>Any number of senders may {@link #push} and {@link #pushSystemEvent}
 * concurrently; the owning actor's loop consumes with {@link #receive}. All
 * access to the queue and the dead flag happens under one lock, and waiting is
 * delegated to a {@link SignalBackend} chosen at construction:
 * <ul>
 *   <li>{@link ThreadConditionSignal} - the consumer blocks its thread</li>
 *   <li>{@link ReactorWaker} - the consumer task is suspended by a reactor</li>
 * </ul>
 *
 * <p>Ordering: ordinary messages are FIFO. A system event is inserted at the
 * head of the queue and is returned by the next receive whatever its filter.
 *
 * @param <M> The type of ordinary messages
 */
public class Mailbox<M> implements Iterable<Delivery<M>> {
    private static final Logger logger = LoggerFactory.getLogger(Mailbox.class);

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Delivery<M>> queue = new ArrayDeque<>();
    private final SignalBackend signal;
    private boolean dead = false;

    /**
     * Creates a mailbox whose backend is built by the given factory.
     *
     * @param name the mailbox name, used in logs and exceptions
     * @param signalFactory creates the signal backend bound to this mailbox's lock
     */
    public Mailbox(String name, SignalBackend.Factory signalFactory) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(signalFactory, "Signal factory cannot be null");
        this.signal = Objects.requireNonNull(signalFactory.create(lock), "Signal backend cannot be null");
        logger.debug("Created mailbox {} with {}", name, signal.getClass().getSimpleName());
    }

    /**
     * Creates a mailbox for a consumer that blocks its own thread.
     *
     * @param name the mailbox name
     * @return a new mailbox backed by a {@link ThreadConditionSignal}
     */
    public static <M> Mailbox<M> threaded(String name) {
        return new Mailbox<>(name, ThreadConditionSignal::new);
    }

    /**
     * Creates a mailbox for a consumer running as a reactor task.
     *
     * <p>The mailbox then has a single consumer: while one {@link #receive}
     * is suspended, a concurrent receive fails with
     * {@link IllegalStateException} and leaves the mailbox untouched.
     *
     * @param name the mailbox name
     * @param waker the waker; owned by the mailbox from now on
     * @return a new mailbox backed by the waker
     */
    public static <M> Mailbox<M> reactive(String name, ReactorWaker waker) {
        Objects.requireNonNull(waker, "Waker cannot be null");
        return new Mailbox<>(name, lock -> waker);
    }

    /**
     * Appends a message to the tail of the mailbox and wakes the consumer.
     *
     * @param message the message to add
     * @throws DeadRecipientException if the mailbox is dead or its consumer can no longer be woken
     */
    public void push(M message) {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lock();
        try {
            if (dead) {
                throw new DeadRecipientException(name);
            }
            queue.addLast(Delivery.delivered(message));
            try {
                signal.signal();
            } catch (DeadWakerException e) {
                // Hand the message back to the sender rather than leave it unreachable
                queue.pollLast();
                throw new DeadRecipientException(name, e);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts a system event at the head of the mailbox and wakes the consumer.
     * Sending to a dead mailbox is silently ignored.
     *
     * @param event the system event
     */
    public void pushSystemEvent(SystemEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        lock.lock();
        try {
            if (dead) {
                logger.debug("Dropping {} sent to dead mailbox {}", event, name);
                return;
            }
            queue.addFirst(Delivery.interrupted(event));
            try {
                signal.signal();
            } catch (DeadWakerException e) {
                logger.debug("Waker of mailbox {} is dead, {} not signaled", name, event);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Receives the next ordinary message or system event, waiting as long as
     * necessary.
     *
     * @return the received delivery
     * @throws DeadMailboxException if the mailbox is already dead
     * @throws MailboxShutdownDuringReceiveException if the mailbox dies while waiting
     * @throws InterruptedException if interrupted while waiting
     */
    public Delivery<M> receive() throws InterruptedException {
        return receive(message -> true);
    }

    /**
     * Receives the first queued message matching {@code filter}, waiting until
     * one arrives. A queued system event always wins over the filter.
     * Non-matching messages stay queued in their original order.
     *
     * @param filter selects which ordinary message to take
     * @return the received delivery
     * @throws DeadMailboxException if the mailbox is already dead
     * @throws MailboxShutdownDuringReceiveException if the mailbox dies while waiting
     * @throws IllegalStateException if another receive is suspended on a reactor mailbox
     * @throws InterruptedException if interrupted while waiting
     */
    public Delivery<M> receive(Predicate<? super M> filter) throws InterruptedException {
        Objects.requireNonNull(filter, "Filter cannot be null");
        Delivery<M> delivery;
        DeadWakerException wakerFailure = null;

        lock.lock();
        try {
            if (dead) {
                throw new DeadMailboxException(name);
            }
            while ((delivery = takeFirstMatch(filter)) == null) {
                try {
                    signal.await(lock);
                } catch (DeadWakerException e) {
                    if (dead) {
                        throw new MailboxShutdownDuringReceiveException(name, e);
                    }
                    wakerFailure = e;
                    break;
                }
                if (dead) {
                    throw new MailboxShutdownDuringReceiveException(name);
                }
            }
        } finally {
            lock.unlock();
        }

        if (wakerFailure != null) {
            logger.warn("Waker of mailbox {} died during receive, forcing shutdown", name);
            shutdown();
            throw new MailboxShutdownDuringReceiveException(name, wakerFailure);
        }
        return delivery;
    }

    // Must be called with the lock held
    private Delivery<M> takeFirstMatch(Predicate<? super M> filter) {
        Iterator<Delivery<M>> it = queue.iterator();
        while (it.hasNext()) {
            Delivery<M> candidate = it.next();
            if (candidate instanceof Delivery.Delivered<M> delivered && !filter.test(delivered.message())) {
                continue;
            }
            it.remove();
            return candidate;
        }
        return null;
    }

    /**
     * Marks the mailbox dead, drains it, and cleans up every drained message
     * that implements {@link Cleanable}. Safe to call repeatedly and from any
     * thread, including while a receive is blocked.
     */
    public void shutdown() {
        List<Delivery<M>> drained;
        boolean wasAlive;

        lock.lock();
        try {
            drained = new ArrayList<>(queue);
            queue.clear();
            wasAlive = !dead;
            dead = true;
        } finally {
            lock.unlock();
        }

        signal.cleanup();

        for (Delivery<M> delivery : drained) {
            if (delivery.payload() instanceof Cleanable cleanable) {
                try {
                    cleanable.cleanup();
                } catch (RuntimeException e) {
                    logger.warn("Cleanup of {} in mailbox {} failed: {}", cleanable, name, e.getMessage(), e);
                }
            }
        }

        if (wasAlive) {
            logger.debug("Mailbox {} shut down, {} pending messages cleaned up", name, drained.size());
        }
    }

    /**
     * Returns a copy of the queued deliveries, head first. Does not change the mailbox.
     *
     * @return the current contents
     */
    public List<Delivery<M>> snapshot() {
        lock.lock();
        try {
            return List.copyOf(queue);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Iterates over a {@link #snapshot()} of the mailbox.
     */
    @Override
    public Iterator<Delivery<M>> iterator() {
        return snapshot().iterator();
    }

    /**
     * Returns the number of queued deliveries.
     *
     * @return the queue size
     */
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns false once {@link #shutdown()} has been called.
     *
     * @return true if the mailbox still accepts messages
     */
    public boolean isAlive() {
        lock.lock();
        try {
            return !dead;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the mailbox name
     */
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        String contents = snapshot().stream()
                .map(delivery -> String.valueOf(delivery.payload()))
                .collect(Collectors.joining(", "));
        return "Mailbox[" + name + "] [" + contents + "]";
    }
}
