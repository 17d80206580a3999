package com.netaudit.topology.discovery.service;

import com.netaudit.topology.discovery.model.AttemptResult;
import com.netaudit.topology.discovery.model.ConnectionErrorKind;
import com.netaudit.topology.discovery.session.SessionException;

public final class RetryPolicy {

    private RetryPolicy() {}

    public static AttemptResult decide(Throwable failure) {
        if (failure instanceof SessionException sessionException) {
            ConnectionErrorKind kind = sessionException.kind();
            return kind.isRetryable() ? AttemptResult.retry(kind) : AttemptResult.stop(kind);
        }
        return AttemptResult.retry(ConnectionErrorKind.UNEXPECTED_ERROR);
    }
}
