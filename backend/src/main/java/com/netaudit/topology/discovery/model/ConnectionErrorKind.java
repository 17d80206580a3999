package com.netaudit.topology.discovery.model;

public enum ConnectionErrorKind {
    AUTHENTICATION_ERROR("AuthenticationError"),
    TIMEOUT_ERROR("TimeoutError"),
    UNEXPECTED_ERROR("UnexpectedError");

    private final String label;

    ConnectionErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isRetryable() {
        return this != AUTHENTICATION_ERROR;
    }

    @Override
    public String toString() {
        return label;
    }
}
