package com.netaudit.topology.discovery.model;

public record DiscoveryStatusResponse(boolean running, DiscoveryRunSummary lastRun) {
}
