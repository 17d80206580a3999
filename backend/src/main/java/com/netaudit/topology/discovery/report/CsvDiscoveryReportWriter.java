package com.netaudit.topology.discovery.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netaudit.topology.config.AuditorProperties;
import com.netaudit.topology.discovery.model.ConnectionErrorKind;
import com.netaudit.topology.discovery.model.DnsEntry;
import com.netaudit.topology.discovery.model.NeighborRecord;
import com.netaudit.topology.discovery.model.ResultSnapshot;
import com.netaudit.topology.discovery.model.VersionRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class CsvDiscoveryReportWriter implements DiscoveryReportWriter {
    private static final Logger log = LoggerFactory.getLogger(CsvDiscoveryReportWriter.class);

    static final String[] NEIGHBOR_HEADERS = {
        "host", "hostname", "software_version", "serial", "uptime", "neighbor_device_id",
        "neighbor_address", "local_interface", "remote_interface", "platform", "capabilities"
    };
    static final String[] DNS_HEADERS = {"hostname", "address"};
    static final String[] AUTH_ERROR_HEADERS = {"host", "username"};
    static final String[] CONNECTION_ERROR_HEADERS = {"host", "error"};

    private final AuditorProperties properties;
    private final ObjectMapper objectMapper;

    public CsvDiscoveryReportWriter(AuditorProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void verifyDestination() throws IOException {
        Path directory = reportDirectory();
        Files.createDirectories(directory);
        if (!Files.isDirectory(directory) || !Files.isWritable(directory)) {
            throw new IOException("report directory is not writable: " + directory);
        }
    }

    @Override
    public List<String> write(String siteName, ResultSnapshot snapshot) throws IOException {
        Path directory = reportDirectory();
        Files.createDirectories(directory);
        String prefix = safeFileName(siteName);
        List<String> written = new ArrayList<>();

        Path neighbors = directory.resolve(prefix + "_neighbors.csv");
        try (CSVPrinter printer = printer(neighbors, NEIGHBOR_HEADERS)) {
            for (NeighborRecord row : snapshot.neighbors()) {
                VersionRecord version = row.version() == null ? VersionRecord.unknown() : row.version();
                printer.printRecord(
                    row.host(),
                    row.hostname(),
                    version.softwareVersion(),
                    version.serial(),
                    version.uptime(),
                    row.neighborDeviceId(),
                    row.neighborAddress(),
                    row.localInterface(),
                    row.remoteInterface(),
                    row.platform(),
                    String.join(" ", row.capabilities() == null ? List.of() : row.capabilities())
                );
            }
        }
        written.add(neighbors.toString());

        Path dns = directory.resolve(prefix + "_dns.csv");
        try (CSVPrinter printer = printer(dns, DNS_HEADERS)) {
            for (DnsEntry entry : snapshot.dnsEntries()) {
                printer.printRecord(entry.hostname(), entry.address());
            }
        }
        written.add(dns.toString());

        Path authErrors = directory.resolve(prefix + "_auth_errors.csv");
        try (CSVPrinter printer = printer(authErrors, AUTH_ERROR_HEADERS)) {
            for (Map.Entry<String, String> entry : snapshot.authErrors().entrySet()) {
                printer.printRecord(entry.getKey(), entry.getValue());
            }
        }
        written.add(authErrors.toString());

        Path connectionErrors = directory.resolve(prefix + "_connection_errors.csv");
        try (CSVPrinter printer = printer(connectionErrors, CONNECTION_ERROR_HEADERS)) {
            for (Map.Entry<String, ConnectionErrorKind> entry : snapshot.connectionErrors().entrySet()) {
                printer.printRecord(entry.getKey(), entry.getValue().label());
            }
        }
        written.add(connectionErrors.toString());

        Path summary = directory.resolve(prefix + "_summary.json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(summary.toFile(), summaryOf(siteName, snapshot));
        written.add(summary.toString());

        log.info("Wrote {} report files for site {} to {}", written.size(), siteName, directory);
        return written;
    }

    private Map<String, Object> summaryOf(String siteName, ResultSnapshot snapshot) {
        Map<String, Long> byKind = new LinkedHashMap<>();
        for (ConnectionErrorKind kind : ConnectionErrorKind.values()) {
            byKind.put(kind.label(), snapshot.countByKind(kind));
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("site", siteName);
        summary.put("generatedAt", Instant.now());
        summary.put("visitedCount", snapshot.visitedCount());
        summary.put("neighborRowCount", snapshot.neighbors().size());
        summary.put("authErrorCount", snapshot.authErrorCount());
        summary.put("connectionErrorCount", snapshot.connectionErrorCount());
        summary.put("connectionErrorsByKind", byKind);
        summary.put("visitedHosts", snapshot.visitedHosts());
        return summary;
    }

    private CSVPrinter printer(Path path, String[] headers) throws IOException {
        Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(headers)
            .build();
        return new CSVPrinter(writer, format);
    }

    private Path reportDirectory() {
        return Path.of(properties.getReport().getDirectory()).toAbsolutePath().normalize();
    }

    static String safeFileName(String siteName) {
        if (siteName == null || siteName.isBlank()) {
            return "site";
        }
        return siteName.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
