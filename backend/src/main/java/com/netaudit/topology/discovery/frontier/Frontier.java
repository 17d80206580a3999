package com.netaudit.topology.discovery.frontier;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Deduplicating work queue of hosts for one discovery run.
 *
 * <p>A host moves {@code enqueued -> in-flight -> visited} and never goes back; at any moment it
 * is in at most one of the three sets. A host is in flight between {@link #dequeue(Duration)} and
 * {@link #markVisited(String)} and is owned by the thread that dequeued it. The outstanding
 * counter covers queued plus in-flight hosts, so the frontier is quiescent only when nothing is
 * queued and every dequeued host has been marked visited.
 */
public class Frontier {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();
    private final Condition quiescent = lock.newCondition();
    private final Set<String> visited = new LinkedHashSet<>();
    private final Set<String> enqueued = new HashSet<>();
    private final Set<String> inFlight = new HashSet<>();
    private final Deque<String> queue = new ArrayDeque<>();
    private int outstanding;
    private boolean closed;

    public boolean tryEnqueue(String host) {
        if (host == null || host.isBlank()) {
            return false;
        }
        String normalized = host.trim();
        lock.lock();
        try {
            if (closed || visited.contains(normalized) || inFlight.contains(normalized) || !enqueued.add(normalized)) {
                return false;
            }
            queue.addLast(normalized);
            outstanding++;
            workAvailable.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the head of the queue, waiting at most {@code pollInterval} for one to arrive.
     * Returns empty on timeout or once the frontier is closed.
     */
    public Optional<String> dequeue(Duration pollInterval) throws InterruptedException {
        long remainingNanos = Math.max(0L, pollInterval.toNanos());
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed) {
                if (remainingNanos <= 0L) {
                    return Optional.empty();
                }
                remainingNanos = workAvailable.awaitNanos(remainingNanos);
            }
            if (closed) {
                return Optional.empty();
            }
            String host = queue.pollFirst();
            enqueued.remove(host);
            inFlight.add(host);
            return Optional.of(host);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a dequeued host to {@code visited}. Hosts that were never dequeued are recorded as
     * visited without touching the outstanding count.
     */
    public void markVisited(String host) {
        if (host == null) {
            return;
        }
        String normalized = host.trim();
        lock.lock();
        try {
            boolean wasInFlight = inFlight.remove(normalized);
            visited.add(normalized);
            if (wasInFlight && outstanding > 0) {
                outstanding--;
            }
            if (queue.isEmpty() && outstanding == 0) {
                quiescent.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isQuiescent() {
        lock.lock();
        try {
            return queue.isEmpty() && outstanding == 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the frontier is quiescent or {@code timeout} elapses.
     *
     * @return true if quiescent on return
     */
    public boolean awaitQuiescence(Duration timeout) throws InterruptedException {
        long remainingNanos = Math.max(0L, timeout.toNanos());
        lock.lockInterruptibly();
        try {
            while (!(queue.isEmpty() && outstanding == 0)) {
                if (remainingNanos <= 0L) {
                    return false;
                }
                remainingNanos = quiescent.awaitNanos(remainingNanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Shutdown signal: wakes every waiting dequeuer and refuses further work.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            workAvailable.signalAll();
            quiescent.signalAll();
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

    public boolean isVisited(String host) {
        lock.lock();
        try {
            return host != null && visited.contains(host.trim());
        } finally {
            lock.unlock();
        }
    }

    public Set<String> visitedSnapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(visited));
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int outstandingCount() {
        lock.lock();
        try {
            return outstanding;
        } finally {
            lock.unlock();
        }
    }
}
