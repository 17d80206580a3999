package com.netaudit.topology.discovery.model;

import java.util.List;

public record DeviceDiscoveryResult(
    String host,
    VersionRecord version,
    List<NeighborRecord> neighbors,
    List<String> neighborAddresses
) {
}
