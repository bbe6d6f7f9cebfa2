package com.metasrv.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Publishes {@link RaftMetrics} snapshots and lets callers wait for a condition
 * on them.
 *
 * <p>The owning {@link RaftNode} is the only publisher. Consumers either read
 * {@link #current()}, register a listener with {@link #subscribe(Consumer)}, or
 * block in {@link #await(Predicate, Duration, String)} until the predicate
 * holds. Waiting uses a condition variable signalled on every publish, so no
 * polling is involved.
 *
 * <p>After {@link #close()} every waiter fails with {@link IllegalStateException}
 * and further publishes are ignored.
 */
public class MetricsWatcher {

    private static final Logger logger = LoggerFactory.getLogger(MetricsWatcher.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final List<Consumer<RaftMetrics>> listeners = new CopyOnWriteArrayList<>();

    private volatile RaftMetrics current;
    private volatile boolean closed = false;

    public MetricsWatcher(RaftMetrics initial) {
        this.current = Objects.requireNonNull(initial);
    }

    public RaftMetrics current() {
        return current;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Replaces the current metrics and wakes all waiters. Unchanged metrics are
     * not re-published.
     */
    void publish(RaftMetrics metrics) {
        lock.lock();
        try {
            if (closed || metrics.equals(current)) {
                return;
            }
            current = metrics;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        for (Consumer<RaftMetrics> listener : listeners) {
            try {
                listener.accept(metrics);
            } catch (RuntimeException e) {
                logger.warn("Metrics listener failed", e);
            }
        }
    }

    /**
     * Registers a listener invoked with every published metrics value.
     *
     * @return a handle that removes the listener when run
     */
    public Runnable subscribe(Consumer<RaftMetrics> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Closes the stream. Waiters are woken and fail.
     */
    void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        listeners.clear();
    }

    /**
     * Blocks until {@code predicate} holds for the current metrics.
     *
     * @param predicate the condition to wait for
     * @param timeout maximum time to wait
     * @param message describes the awaited condition in the timeout error
     * @return the metrics that satisfied the predicate
     * @throws TimeoutException if the condition does not hold in time
     * @throws InterruptedException if the calling thread is interrupted
     * @throws IllegalStateException if the stream is closed while waiting
     */
    public RaftMetrics await(Predicate<RaftMetrics> predicate, Duration timeout, String message)
            throws TimeoutException, InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                RaftMetrics m = current;
                if (predicate.test(m)) {
                    return m;
                }
                if (closed) {
                    throw new IllegalStateException("Metrics stream closed while waiting for: " + message);
                }
                if (remaining <= 0) {
                    throw new TimeoutException("Timeout after " + timeout.toMillis() + "ms waiting for: "
                            + message + "; latest: " + m);
                }
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    // ==================== Common conditions ====================

    /**
     * Waits until at least {@code index} entries are applied.
     */
    public RaftMetrics awaitLog(long index, Duration timeout, String message)
            throws TimeoutException, InterruptedException {
        return await(m -> m.lastApplied() >= index, timeout, message + " (applied >= " + index + ")");
    }

    public RaftMetrics awaitRole(Role role, Duration timeout)
            throws TimeoutException, InterruptedException {
        return await(m -> m.role() == role, timeout, "role " + role);
    }

    public RaftMetrics awaitLeader(NodeId leader, Duration timeout)
            throws TimeoutException, InterruptedException {
        return await(m -> leader.equals(m.currentLeader()), timeout, "current leader " + leader);
    }

    /**
     * Waits until the effective membership contains exactly {@code members}
     * (voters and learners together).
     */
    public RaftMetrics awaitMembers(Set<NodeId> members, Duration timeout, String message)
            throws TimeoutException, InterruptedException {
        return await(m -> m.membership().allMembers().equals(members), timeout,
                message + " (members " + members + ")");
    }

    /**
     * Waits until the local snapshot covers at least {@code index}.
     */
    public RaftMetrics awaitSnapshot(long index, Duration timeout, String message)
            throws TimeoutException, InterruptedException {
        return await(m -> m.snapshot() != null && m.snapshot().lastIncludedIndex() >= index, timeout,
                message + " (snapshot index >= " + index + ")");
    }

    /**
     * Convenience wrapper for timeouts given in milliseconds.
     */
    public RaftMetrics await(Predicate<RaftMetrics> predicate, long timeoutMs, String message)
            throws TimeoutException, InterruptedException {
        return await(predicate, Duration.ofMillis(timeoutMs), message);
    }
}
