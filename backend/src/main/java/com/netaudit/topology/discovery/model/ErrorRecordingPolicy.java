package com.netaudit.topology.discovery.model;

/**
 * Which error survives when several attempts against one host fail with different kinds.
 */
public enum ErrorRecordingPolicy {
    LAST_WRITE_WINS,
    FIRST_WRITE_WINS
}
