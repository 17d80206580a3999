package com.netaudit.topology.discovery.service;

import com.netaudit.topology.discovery.model.AttemptResult;
import com.netaudit.topology.discovery.model.ConnectionErrorKind;
import com.netaudit.topology.discovery.session.AuthenticationFailedException;
import com.netaudit.topology.discovery.session.SessionPhase;
import com.netaudit.topology.discovery.session.SessionTimeoutException;
import com.netaudit.topology.discovery.session.UnexpectedSessionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void authenticationFailureStops() {
        AttemptResult result = RetryPolicy.decide(
            new AuthenticationFailedException(SessionPhase.AUTHENTICATING, "denied", null)
        );

        assertEquals(AttemptResult.Decision.STOP, result.decision());
        assertEquals(ConnectionErrorKind.AUTHENTICATION_ERROR, result.errorKind());
        assertFalse(result.shouldRetry());
    }

    @Test
    void timeoutRetries() {
        AttemptResult result = RetryPolicy.decide(new SessionTimeoutException(SessionPhase.BANNER_WAIT, "late"));

        assertTrue(result.shouldRetry());
        assertEquals(ConnectionErrorKind.TIMEOUT_ERROR, result.errorKind());
    }

    @Test
    void unexpectedFailuresRetry() {
        assertEquals(
            AttemptResult.retry(ConnectionErrorKind.UNEXPECTED_ERROR),
            RetryPolicy.decide(new UnexpectedSessionException(SessionPhase.COMMAND_EXECUTING, "boom", null))
        );
        assertEquals(
            AttemptResult.retry(ConnectionErrorKind.UNEXPECTED_ERROR),
            RetryPolicy.decide(new IllegalStateException("parser blew up"))
        );
    }
}
