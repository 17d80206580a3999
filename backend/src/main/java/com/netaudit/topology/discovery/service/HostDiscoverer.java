package com.netaudit.topology.discovery.service;

import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.DeviceDiscoveryResult;
import com.netaudit.topology.discovery.model.RunConfig;
import com.netaudit.topology.discovery.session.SessionException;

/**
 * One discovery attempt against one host: a fresh session, the discovery commands, parsing.
 */
@FunctionalInterface
public interface HostDiscoverer {

    DeviceDiscoveryResult discover(String host, CredentialPair credentials, RunConfig config) throws SessionException;
}
