package com.netaudit.topology.discovery.model;

import java.util.List;
import java.util.Map;

public record ResultSnapshot(
    List<String> visitedHosts,
    List<NeighborRecord> neighbors,
    List<DnsEntry> dnsEntries,
    Map<String, String> authErrors,
    Map<String, ConnectionErrorKind> connectionErrors
) {
    public int visitedCount() {
        return visitedHosts.size();
    }

    public int authErrorCount() {
        return authErrors.size();
    }

    public int connectionErrorCount() {
        return connectionErrors.size();
    }

    public long countByKind(ConnectionErrorKind kind) {
        return connectionErrors.values().stream().filter(kind::equals).count();
    }
}
