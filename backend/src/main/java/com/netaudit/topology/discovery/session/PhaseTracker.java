package com.netaudit.topology.discovery.session;

/**
 * Source of the current phase and the moment it started, read by {@link PhaseTimer}.
 */
public interface PhaseTracker {

    SessionPhase phase();

    long phaseStartedNanos();
}
