package com.netaudit.topology.discovery.service;

import com.netaudit.topology.discovery.frontier.Frontier;
import com.netaudit.topology.discovery.model.AttemptResult;
import com.netaudit.topology.discovery.model.ConnectionErrorKind;
import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.DeviceDiscoveryResult;
import com.netaudit.topology.discovery.model.RunConfig;
import com.netaudit.topology.discovery.session.SessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads draining one run's {@link Frontier}.
 *
 * <p>Every dequeued host is marked visited exactly once, from a {@code finally} block, after
 * its own neighbors have been enqueued. Errors are recorded per host and never leave the
 * worker.
 */
public class DiscoveryWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryWorkerPool.class);

    private final Frontier frontier;
    private final ResultStore store;
    private final HostDiscoverer discoverer;
    private final RunConfig config;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger liveWorkers = new AtomicInteger();
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;

    public DiscoveryWorkerPool(Frontier frontier, ResultStore store, HostDiscoverer discoverer, RunConfig config) {
        this.frontier = frontier;
        this.store = store;
        this.discoverer = discoverer;
        this.config = config;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = config.workerCount();
            AtomicInteger threadIndex = new AtomicInteger();
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("discovery-worker-" + threadIndex.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            liveWorkers.set(workerCount);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.execute(() -> workerLoop(workerIndex));
            }
            log.debug("Started {} discovery workers", workerCount);
        }
    }

    /**
     * Broadcasts shutdown. Workers finish the host they hold, then exit on their next dequeue.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            running.set(false);
            frontier.close();
            if (executor != null) {
                executor.shutdown();
            }
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ExecutorService current;
        synchronized (lifecycleLock) {
            current = executor;
        }
        return current == null || current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int liveWorkers() {
        return liveWorkers.get();
    }

    private void workerLoop(int workerIndex) {
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                Optional<String> next;
                try {
                    next = frontier.dequeue(config.pollInterval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (next.isEmpty()) {
                    if (frontier.isClosed()) {
                        return;
                    }
                    continue;
                }
                try {
                    processHost(next.get());
                } catch (Exception e) {
                    log.warn("Discovery worker {} failed while processing {}", workerIndex, next.get(), e);
                } catch (Error e) {
                    log.error("Discovery worker {} died while processing {}; {} workers left",
                        workerIndex, next.get(), liveWorkers.get() - 1, e);
                    throw e;
                }
            }
        } finally {
            liveWorkers.decrementAndGet();
            log.debug("Discovery worker {} exiting", workerIndex);
        }
    }

    /**
     * Runs up to {@link RunConfig#maxAttempts()} attempts against one dequeued host. A rejected
     * credential pair moves on to the next configured pair without consuming an attempt.
     */
    void processHost(String host) {
        HostErrorTracker errors = new HostErrorTracker(config.errorPolicy());
        boolean succeeded = false;
        try {
            List<CredentialPair> credentials = config.credentials();
            int credentialIndex = 0;
            int attempt = 0;
            while (attempt < config.maxAttempts()) {
                attempt++;
                CredentialPair pair = credentials.get(credentialIndex);
                AttemptResult result = attempt(host, pair, attempt, errors);
                if (result.isSuccess()) {
                    errors.clear();
                    succeeded = true;
                    break;
                }
                if (result.errorKind() == ConnectionErrorKind.AUTHENTICATION_ERROR
                    && credentialIndex + 1 < credentials.size()) {
                    credentialIndex++;
                    attempt--;
                    log.info("Authentication to {} rejected for {}, trying {}", host, pair.username(),
                        credentials.get(credentialIndex).username());
                    continue;
                }
                if (!result.shouldRetry()) {
                    break;
                }
                if (attempt < config.maxAttempts()) {
                    pause(config.retryDelay());
                }
            }
        } catch (RuntimeException e) {
            errors.record(ConnectionErrorKind.UNEXPECTED_ERROR, null);
            log.warn("Unexpected failure while processing {}", host, e);
        } finally {
            Optional<ConnectionErrorKind> pending = errors.pending();
            if (pending.isPresent()) {
                store.recordConnectionError(host, pending.get(), errors.username());
                log.warn("Host {} failed: {}", host, pending.get());
            } else if (succeeded) {
                store.recordSuccess(host);
            }
            frontier.markVisited(host);
        }
    }

    private AttemptResult attempt(String host, CredentialPair credentials, int attempt, HostErrorTracker errors) {
        DeviceDiscoveryResult result;
        try {
            result = discoverer.discover(host, credentials, config);
        } catch (SessionException | RuntimeException e) {
            AttemptResult decision = RetryPolicy.decide(e);
            errors.record(decision.errorKind(), credentials.username());
            log.warn("Attempt {}/{} against {} failed: {} ({})", attempt, config.maxAttempts(), host,
                decision.errorKind(), e.getMessage());
            log.debug("Attempt failure detail for {}", host, e);
            return decision;
        }

        store.addNeighbors(result.neighbors());
        int added = 0;
        for (String address : result.neighborAddresses()) {
            if (frontier.tryEnqueue(address)) {
                added++;
            }
        }
        log.info("Discovered {}: {} neighbors, {} new hosts queued", host, result.neighbors().size(), added);
        return AttemptResult.success();
    }

    private static void pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
