package com.netaudit.topology.discovery.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record DiscoveryRunRequest(
    List<String> seeds,
    String siteName,
    CredentialPair credentials,
    CredentialPair alternateCredentials,
    String bastionHost,
    Boolean writeReport
) {
    public List<String> normalizedSeeds() {
        if (seeds == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String seed : seeds) {
            if (seed == null) {
                continue;
            }
            String normalized = seed.trim();
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return new ArrayList<>(out);
    }

    public static DiscoveryRunRequest ofSeeds(List<String> seeds, String siteName) {
        return new DiscoveryRunRequest(seeds, siteName, null, null, null, null);
    }
}
