package com.netaudit.topology.discovery.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record DiscoveryRunSummary(
    String runId,
    String siteName,
    Instant startedAt,
    Instant finishedAt,
    String status,
    int visitedCount,
    int authErrorCount,
    int connectionErrorCount,
    int neighborRowCount,
    Map<String, String> connectionErrors,
    boolean reportWritten,
    List<String> reportFiles
) {
}
