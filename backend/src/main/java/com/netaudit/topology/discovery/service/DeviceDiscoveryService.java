package com.netaudit.topology.discovery.service;

import com.netaudit.topology.config.AuditorProperties;
import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.DeviceDiscoveryResult;
import com.netaudit.topology.discovery.model.NeighborRecord;
import com.netaudit.topology.discovery.model.RunConfig;
import com.netaudit.topology.discovery.model.VersionRecord;
import com.netaudit.topology.discovery.parse.OutputParser;
import com.netaudit.topology.discovery.session.DeviceSession;
import com.netaudit.topology.discovery.session.SessionException;
import com.netaudit.topology.discovery.session.SessionFactory;
import com.netaudit.topology.discovery.util.HostAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class DeviceDiscoveryService implements HostDiscoverer {
    private static final Logger log = LoggerFactory.getLogger(DeviceDiscoveryService.class);

    private final AuditorProperties properties;
    private final SessionFactory sessionFactory;
    private final OutputParser outputParser;

    public DeviceDiscoveryService(AuditorProperties properties, SessionFactory sessionFactory, OutputParser outputParser) {
        this.properties = properties;
        this.sessionFactory = sessionFactory;
        this.outputParser = outputParser;
    }

    @Override
    public DeviceDiscoveryResult discover(String host, CredentialPair credentials, RunConfig config) throws SessionException {
        String neighborOutput;
        String versionOutput;
        try (DeviceSession session = sessionFactory.open(host, credentials, config)) {
            neighborOutput = session.execute(properties.getCommands().getNeighbors());
            versionOutput = session.execute(properties.getCommands().getVersion());
        }

        VersionRecord version = parseVersion(versionOutput);
        List<Map<String, String>> rows = outputParser.parse(neighborOutput, properties.getTemplates().getNeighbors());
        List<NeighborRecord> neighbors = new ArrayList<>();
        Set<String> addresses = new LinkedHashSet<>();
        for (Map<String, String> row : rows) {
            NeighborRecord neighbor = toNeighbor(host, version, row);
            neighbors.add(neighbor);
            if (isTraversable(neighbor)) {
                addresses.add(neighbor.neighborAddress());
            }
        }
        log.debug("Host {} ({}) reported {} CDP neighbors, {} traversable", host, version.hostname(), neighbors.size(), addresses.size());
        return new DeviceDiscoveryResult(host, version, List.copyOf(neighbors), List.copyOf(addresses));
    }

    private VersionRecord parseVersion(String output) {
        List<Map<String, String>> rows = outputParser.parse(output, properties.getTemplates().getVersion());
        if (rows.isEmpty()) {
            return VersionRecord.unknown();
        }
        Map<String, String> row = rows.get(0);
        return new VersionRecord(row.get("HOSTNAME"), row.get("VERSION"), row.get("UPTIME"), row.get("SERIAL"));
    }

    private NeighborRecord toNeighbor(String host, VersionRecord version, Map<String, String> row) {
        return new NeighborRecord(
            host,
            version.hostname(),
            row.get("NEIGHBOR_NAME"),
            row.get("LOCAL_INTERFACE"),
            row.get("REMOTE_INTERFACE"),
            row.get("PLATFORM"),
            row.get("MANAGEMENT_IP"),
            splitCapabilities(row.get("CAPABILITIES")),
            version
        );
    }

    boolean isTraversable(NeighborRecord neighbor) {
        String address = neighbor.neighborAddress();
        if (!HostAddresses.isAddressLiteral(address) || HostAddresses.isUnusable(address)) {
            return false;
        }
        List<String> required = properties.getNeighborFilter().getRequiredCapabilities();
        if (required != null && !required.isEmpty()) {
            boolean matches = neighbor.capabilities().stream()
                .anyMatch(capability -> required.stream().anyMatch(capability::equalsIgnoreCase));
            if (!matches) {
                return false;
            }
        }
        String platform = neighbor.platform() == null ? "" : neighbor.platform().toLowerCase(Locale.ROOT);
        List<String> excluded = properties.getNeighborFilter().getExcludedPlatformPrefixes();
        if (excluded != null) {
            for (String prefix : excluded) {
                if (prefix != null && !prefix.isBlank() && platform.startsWith(prefix.trim().toLowerCase(Locale.ROOT))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static List<String> splitCapabilities(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.trim().split("\\s+"))
            .filter(value -> !value.isBlank())
            .toList();
    }
}
