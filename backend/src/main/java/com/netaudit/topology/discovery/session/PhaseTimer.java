package com.netaudit.topology.discovery.session;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking session call under a per-phase deadline.
 *
 * <p>The deadline is {@code phaseStartedNanos + timeout} of whatever phase the tracker reports,
 * so one call that moves through several phases gets a full timeout for each of them and never
 * more. A call still running past its deadline is interrupted and reported as a
 * {@link SessionTimeoutException}; the caller must close the underlying client to release it.
 */
@Component
public class PhaseTimer {
    private final ExecutorService executor;

    public PhaseTimer(@Qualifier("sessionPhaseExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    public <T> T run(PhaseTracker tracker, Duration timeout, Callable<T> call) throws SessionException {
        long timeoutNanos = Math.max(1L, timeout.toNanos());
        Future<T> future = executor.submit(call);
        try {
            while (true) {
                SessionPhase phase = tracker.phase();
                long remaining = tracker.phaseStartedNanos() + timeoutNanos - System.nanoTime();
                if (remaining <= 0L) {
                    future.cancel(true);
                    throw new SessionTimeoutException(
                        phase,
                        "phase " + phase + " exceeded " + timeout.toMillis() + "ms"
                    );
                }
                try {
                    return future.get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException ignored) {
                    // deadline re-read on the next pass in case the call moved to a new phase
                }
            }
        } catch (ExecutionException e) {
            throw SessionErrorClassifier.classify(tracker.phase(), e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UnexpectedSessionException(tracker.phase(), "interrupted", e);
        }
    }
}
