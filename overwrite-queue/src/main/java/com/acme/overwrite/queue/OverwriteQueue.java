package com.acme.overwrite.queue;

import com.acme.overwrite.telemetry.NoopQueueMetrics;
import com.acme.overwrite.telemetry.QueueMetrics;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded multi-producer multi-consumer ring that overwrites its oldest
 * element when full.
 *
 * <p>Storage is a pre-allocated array of exactly {@code capacity} slots with
 * {@code head}/{@code tail} cursors and a live {@code count}; the invariant
 * {@code tail == (head + count) % capacity} holds whenever the lock is free.
 * One {@link ReentrantLock} guards all of it, and a single {@code notEmpty}
 * condition parks consumers.</p>
 *
 * <p>{@link #push(Object)} never blocks: on a full ring it advances
 * {@code head} past the oldest element, which is lost. Consumers either wait
 * indefinitely ({@link #pop()}), wait up to a deadline
 * ({@link #popWithTimeout(Duration)}), or read the instantaneous
 * {@link #count()}.</p>
 *
 * <p>Pop order is push order minus overwritten elements. No ordering is
 * promised among waiting consumer threads.</p>
 */
public final class OverwriteQueue<E> implements OverwriteRing<E> {

    private final Object[] buffer;
    private final int capacity;
    private final QueueMetrics metrics;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private int count;
    private int head;
    private int tail;

    private long pushedTotal;
    private long poppedTotal;
    private long overwrittenTotal;

    public OverwriteQueue(int capacity) {
        this(capacity, NoopQueueMetrics.INSTANCE);
    }

    public OverwriteQueue(int capacity, QueueMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new Object[capacity];
        this.metrics = metrics == null ? NoopQueueMetrics.INSTANCE : metrics;
    }

    /**
     * Fixed number of slots. Never changes, so no lock is taken.
     */
    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * Number of live elements at the moment of the call. May be stale as soon
     * as it returns under concurrent access.
     */
    @Override
    public int count() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends {@code e}, discarding the oldest element if the ring is full.
     * Wakes one waiting consumer.
     */
    @Override
    public void push(E e) {
        Objects.requireNonNull(e, "e");
        boolean overwrote;
        lock.lock();
        try {
            overwrote = count == capacity;
            if (overwrote) {
                // the slot at head is about to be reused by tail
                head = next(head);
                overwrittenTotal++;
            } else {
                count++;
            }
            buffer[tail] = e;
            tail = next(tail);
            pushedTotal++;
            metrics.setDepth(count);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
        metrics.incPushed(1L);
        if (overwrote) {
            metrics.incOverwritten(1L);
        }
    }

    /**
     * Removes and returns the oldest element, waiting as long as it takes for
     * one to arrive.
     *
     * @throws InterruptedException if interrupted while waiting; nothing is consumed
     */
    @Override
    public E pop() throws InterruptedException {
        long startNanos = System.nanoTime();
        E value;
        lock.lockInterruptibly();
        try {
            while (count == 0) {
                notEmpty.await();
            }
            value = dequeue();
        } finally {
            lock.unlock();
        }
        onPopped(startNanos);
        return value;
    }

    /**
     * Removes and returns the oldest element, waiting at most {@code timeout}.
     *
     * <p>A zero or negative timeout is a single non-waiting attempt. On
     * expiry the ring is left exactly as it was and
     * {@link PopResult.TimedOut} is returned.</p>
     *
     * @throws InterruptedException if interrupted while waiting; nothing is consumed
     */
    @Override
    public PopResult<E> popWithTimeout(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        long startNanos = System.nanoTime();
        long remaining = toNanosSaturated(timeout);
        E value;
        lock.lockInterruptibly();
        try {
            while (count == 0) {
                if (remaining <= 0L) {
                    break;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            value = count == 0 ? null : dequeue();
        } finally {
            lock.unlock();
        }
        if (value == null) {
            metrics.incTimeouts(1L);
            return new PopResult.TimedOut<>(System.nanoTime() - startNanos);
        }
        onPopped(startNanos);
        return new PopResult.Item<>(value);
    }

    @Override
    public QueueSnapshot snapshot() {
        lock.lock();
        try {
            return new QueueSnapshot(
                count,
                capacity,
                pushedTotal,
                poppedTotal,
                overwrittenTotal,
                System.nanoTime()
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks the cursor invariants. Intended for diagnostics and tests, not
     * the hot path.
     */
    public boolean validateInvariants() {
        lock.lock();
        try {
            return count >= 0
                && count <= capacity
                && head >= 0 && head < capacity
                && tail >= 0 && tail < capacity
                && tail == (head + count) % capacity
                && pushedTotal == poppedTotal + overwrittenTotal + count;
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock and count > 0
    @SuppressWarnings("unchecked")
    private E dequeue() {
        E value = (E) buffer[head];
        buffer[head] = null;
        head = next(head);
        count--;
        poppedTotal++;
        metrics.setDepth(count);
        return value;
    }

    private void onPopped(long startNanos) {
        metrics.incPopped(1L);
        metrics.observeWaitNanos(System.nanoTime() - startNanos);
    }

    private int next(int index) {
        int n = index + 1;
        return n == capacity ? 0 : n;
    }

    static long toNanosSaturated(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            return 0L;
        }
        try {
            return timeout.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
