package com.netaudit.topology.discovery.model;

import java.time.Duration;
import java.util.List;

public record RunConfig(
    Duration timeout,
    int maxAttempts,
    int workerCount,
    Duration pollInterval,
    Duration retryDelay,
    int sshPort,
    BastionHost bastion,
    List<CredentialPair> credentials,
    ErrorRecordingPolicy errorPolicy
) {
    public RunConfig {
        credentials = credentials == null ? List.of() : List.copyOf(credentials);
    }

    public boolean viaBastion() {
        return bastion != null;
    }
}
