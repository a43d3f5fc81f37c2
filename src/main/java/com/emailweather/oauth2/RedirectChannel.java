package com.emailweather.oauth2;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded hand-off of {@link RedirectParameters} from the redirect HTTP endpoint to the
 * single {@link InstalledFlow} waiting for consent.
 *
 * <p>Senders never block. Closing the channel wakes a waiting receiver, which then fails
 * with {@link ErrorKind#CHANNEL_CLOSED} once no value is left.
 */
public class RedirectChannel {

    /** Capacity used by the application wiring. */
    public static final int DEFAULT_CAPACITY = 1;

    private final int capacity;
    private final Deque<RedirectParameters> queue = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    public RedirectChannel() {
        this(DEFAULT_CAPACITY);
    }

    public RedirectChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    /**
     * Offers a value without blocking.
     *
     * @return false if the channel is full or closed
     */
    public boolean send(RedirectParameters parameters) {
        Preconditions.requireNonNull(parameters, "Redirect parameters");
        lock.lock();
        try {
            if (closed || queue.size() >= capacity) {
                return false;
            }
            queue.addLast(parameters);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next value.
     *
     * @param timeout maximum time to wait, or null to wait indefinitely
     * @return the next value
     * @throws OAuth2Exception {@link ErrorKind#CHANNEL_CLOSED} if closed and drained,
     *                         {@link ErrorKind#CONSENT_TIMEOUT} if the timeout elapses,
     *                         {@link ErrorKind#CANCELLED} if the thread is interrupted
     */
    public RedirectParameters receive(Duration timeout) throws OAuth2Exception {
        long nanos = timeout == null ? 0 : timeout.toNanos();
        try {
            lock.lockInterruptibly();
            try {
                while (queue.isEmpty()) {
                    if (closed) {
                        throw new OAuth2Exception(ErrorKind.CHANNEL_CLOSED,
                                "Redirect channel closed before consent was received");
                    }
                    if (timeout == null) {
                        notEmpty.await();
                    } else {
                        if (nanos <= 0) {
                            throw new OAuth2Exception(ErrorKind.CONSENT_TIMEOUT,
                                    "No consent received within " + timeout.getSeconds() + "s");
                        }
                        nanos = notEmpty.awaitNanos(nanos);
                    }
                }
                return queue.pollFirst();
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OAuth2Exception(ErrorKind.CANCELLED, "Interrupted while waiting for consent", e);
        }
    }

    /**
     * Discards every value nobody has received yet.
     *
     * @return the number of values discarded
     */
    public int clear() {
        lock.lock();
        try {
            int discarded = queue.size();
            queue.clear();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel. Values already sent can still be received. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
