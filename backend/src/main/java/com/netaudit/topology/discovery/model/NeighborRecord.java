package com.netaudit.topology.discovery.model;

import java.util.List;

public record NeighborRecord(
    String host,
    String hostname,
    String neighborDeviceId,
    String localInterface,
    String remoteInterface,
    String platform,
    String neighborAddress,
    List<String> capabilities,
    VersionRecord version
) {
}
