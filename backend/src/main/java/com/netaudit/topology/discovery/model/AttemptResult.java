package com.netaudit.topology.discovery.model;

/**
 * Outcome of one attempt against a host, as seen by the retry loop.
 */
public record AttemptResult(Decision decision, ConnectionErrorKind errorKind) {

    public enum Decision {
        SUCCESS,
        RETRY,
        STOP
    }

    private static final AttemptResult SUCCESS_RESULT = new AttemptResult(Decision.SUCCESS, null);

    public static AttemptResult success() {
        return SUCCESS_RESULT;
    }

    public static AttemptResult retry(ConnectionErrorKind kind) {
        return new AttemptResult(Decision.RETRY, kind);
    }

    public static AttemptResult stop(ConnectionErrorKind kind) {
        return new AttemptResult(Decision.STOP, kind);
    }

    public boolean isSuccess() {
        return decision == Decision.SUCCESS;
    }

    public boolean shouldRetry() {
        return decision == Decision.RETRY;
    }
}
