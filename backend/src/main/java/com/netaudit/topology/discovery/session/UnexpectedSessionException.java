package com.netaudit.topology.discovery.session;

import com.netaudit.topology.discovery.model.ConnectionErrorKind;

public class UnexpectedSessionException extends SessionException {

    public UnexpectedSessionException(SessionPhase phase, String message, Throwable cause) {
        super(phase, message, cause);
    }

    @Override
    public ConnectionErrorKind kind() {
        return ConnectionErrorKind.UNEXPECTED_ERROR;
    }
}
