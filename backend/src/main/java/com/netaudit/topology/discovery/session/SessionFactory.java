package com.netaudit.topology.discovery.session;

import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.RunConfig;

public interface SessionFactory {

    /**
     * Opens a ready session to {@code host}, directly or through the bastion in {@code config}.
     * Every phase is bounded by {@code config.timeout()}.
     */
    DeviceSession open(String host, CredentialPair credentials, RunConfig config) throws SessionException;
}
