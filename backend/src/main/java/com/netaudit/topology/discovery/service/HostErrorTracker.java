package com.netaudit.topology.discovery.service;

import com.netaudit.topology.discovery.model.ConnectionErrorKind;
import com.netaudit.topology.discovery.model.ErrorRecordingPolicy;

import java.util.Optional;

/**
 * Pending error for the host a worker is currently processing.
 */
final class HostErrorTracker {
    private final ErrorRecordingPolicy policy;
    private ConnectionErrorKind kind;
    private String username;

    HostErrorTracker(ErrorRecordingPolicy policy) {
        this.policy = policy;
    }

    void record(ConnectionErrorKind next, String nextUsername) {
        if (next == null) {
            return;
        }
        if (kind != null && policy == ErrorRecordingPolicy.FIRST_WRITE_WINS) {
            return;
        }
        kind = next;
        username = nextUsername;
    }

    void clear() {
        kind = null;
        username = null;
    }

    Optional<ConnectionErrorKind> pending() {
        return Optional.ofNullable(kind);
    }

    String username() {
        return username;
    }
}
