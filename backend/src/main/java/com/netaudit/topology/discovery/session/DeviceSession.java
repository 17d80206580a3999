package com.netaudit.topology.discovery.session;

/**
 * One established remote-shell session to a single device, owned by one worker for one attempt.
 */
public interface DeviceSession extends AutoCloseable {

    String host();

    SessionPhase phase();

    /**
     * Runs one command and returns its raw output. Bounded by the session timeout.
     */
    String execute(String command) throws SessionException;

    @Override
    void close();
}
