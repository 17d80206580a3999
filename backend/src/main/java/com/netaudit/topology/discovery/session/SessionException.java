package com.netaudit.topology.discovery.session;

import com.netaudit.topology.discovery.model.ConnectionErrorKind;

public abstract class SessionException extends Exception {
    private final SessionPhase phase;

    protected SessionException(SessionPhase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public SessionPhase phase() {
        return phase;
    }

    public abstract ConnectionErrorKind kind();
}
