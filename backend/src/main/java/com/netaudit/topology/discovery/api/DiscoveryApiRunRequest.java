package com.netaudit.topology.discovery.api;

import java.util.List;

public record DiscoveryApiRunRequest(
    List<String> seeds,
    String siteName,
    String username,
    String password,
    String alternateUsername,
    String alternatePassword,
    String bastionHost,
    Boolean writeReport
) {
}
