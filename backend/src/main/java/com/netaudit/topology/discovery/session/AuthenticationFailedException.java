package com.netaudit.topology.discovery.session;

import com.netaudit.topology.discovery.model.ConnectionErrorKind;

public class AuthenticationFailedException extends SessionException {

    public AuthenticationFailedException(SessionPhase phase, String message, Throwable cause) {
        super(phase, message, cause);
    }

    @Override
    public ConnectionErrorKind kind() {
        return ConnectionErrorKind.AUTHENTICATION_ERROR;
    }
}
