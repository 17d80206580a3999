package com.netaudit.topology.discovery.session;

import com.netaudit.topology.discovery.model.ConnectionErrorKind;

/**
 * A phase ran past its timeout, or the transport failed before the phase could report one.
 */
public class SessionTimeoutException extends SessionException {

    public SessionTimeoutException(SessionPhase phase, String message) {
        super(phase, message, null);
    }

    public SessionTimeoutException(SessionPhase phase, String message, Throwable cause) {
        super(phase, message, cause);
    }

    @Override
    public ConnectionErrorKind kind() {
        return ConnectionErrorKind.TIMEOUT_ERROR;
    }
}
