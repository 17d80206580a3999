package com.netaudit.topology.discovery.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.netaudit.topology.config.AuditorProperties;
import com.netaudit.topology.discovery.model.ConnectionErrorKind;
import com.netaudit.topology.discovery.model.DnsEntry;
import com.netaudit.topology.discovery.model.NeighborRecord;
import com.netaudit.topology.discovery.model.ResultSnapshot;
import com.netaudit.topology.discovery.model.VersionRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvDiscoveryReportWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private AuditorProperties properties;
    private CsvDiscoveryReportWriter writer;

    @BeforeEach
    void setUp() {
        properties = new AuditorProperties();
        properties.getReport().setDirectory(tempDir.resolve("reports").toString());
        writer = new CsvDiscoveryReportWriter(properties, objectMapper);
    }

    @Test
    void writesOneFilePerTableAndASummary() throws IOException {
        List<String> files = writer.write("Main Campus", snapshot());

        assertThat(files).hasSize(5);
        Path reports = tempDir.resolve("reports");
        assertThat(reports.resolve("Main_Campus_neighbors.csv")).exists();
        assertThat(reports.resolve("Main_Campus_dns.csv")).exists();
        assertThat(reports.resolve("Main_Campus_auth_errors.csv")).exists();
        assertThat(reports.resolve("Main_Campus_connection_errors.csv")).exists();
        assertThat(reports.resolve("Main_Campus_summary.json")).exists();

        List<CSVRecord> neighbors = read(reports.resolve("Main_Campus_neighbors.csv"));
        assertThat(neighbors).hasSize(1);
        CSVRecord row = neighbors.get(0);
        assertThat(row.get("host")).isEqualTo("10.20.0.10");
        assertThat(row.get("hostname")).isEqualTo("access-sw1");
        assertThat(row.get("software_version")).isEqualTo("16.09.04");
        assertThat(row.get("neighbor_device_id")).isEqualTo("dist-sw1.example.net");
        assertThat(row.get("platform")).isEqualTo("cisco WS-C3850-48P");
        assertThat(row.get("capabilities")).isEqualTo("Switch IGMP");

        List<CSVRecord> errors = read(reports.resolve("Main_Campus_connection_errors.csv"));
        assertThat(errors).extracting(record -> record.get("error")).containsExactly("TimeoutError", "AuthenticationError");

        List<CSVRecord> authErrors = read(reports.resolve("Main_Campus_auth_errors.csv"));
        assertThat(authErrors).extracting(record -> record.get("username")).containsExactly("netops");

        List<CSVRecord> dns = read(reports.resolve("Main_Campus_dns.csv"));
        assertThat(dns).extracting(record -> record.get("address")).containsExactly("10.20.0.10", "DNS_FAILURE");
    }

    @Test
    void summaryJsonCarriesCounts() throws IOException {
        writer.write("lab", snapshot());

        JsonNode summary = objectMapper.readTree(tempDir.resolve("reports").resolve("lab_summary.json").toFile());
        assertThat(summary.get("site").asText()).isEqualTo("lab");
        assertThat(summary.get("visitedCount").asInt()).isEqualTo(3);
        assertThat(summary.get("connectionErrorCount").asInt()).isEqualTo(2);
        assertThat(summary.get("connectionErrorsByKind").get("TimeoutError").asInt()).isEqualTo(1);
        assertThat(summary.get("generatedAt").isTextual()).isTrue();
    }

    @Test
    void verifyDestinationCreatesTheDirectory() throws IOException {
        writer.verifyDestination();

        assertThat(tempDir.resolve("reports")).isDirectory();
    }

    @Test
    void siteNamesAreMadeFileSafe() {
        assertThat(CsvDiscoveryReportWriter.safeFileName("HQ/Floor 2")).isEqualTo("HQ_Floor_2");
        assertThat(CsvDiscoveryReportWriter.safeFileName("  ")).isEqualTo("site");
    }

    private static ResultSnapshot snapshot() {
        VersionRecord version = new VersionRecord("access-sw1", "16.09.04", "2 years", "FOC1234X0AB");
        NeighborRecord neighbor = new NeighborRecord(
            "10.20.0.10",
            "access-sw1",
            "dist-sw1.example.net",
            "GigabitEthernet1/0/49",
            "TenGigabitEthernet1/1/1",
            "cisco WS-C3850-48P",
            "10.20.0.2",
            List.of("Switch", "IGMP"),
            version
        );
        Map<String, ConnectionErrorKind> connectionErrors = new LinkedHashMap<>();
        connectionErrors.put("10.20.0.7", ConnectionErrorKind.TIMEOUT_ERROR);
        connectionErrors.put("10.20.0.8", ConnectionErrorKind.AUTHENTICATION_ERROR);
        return new ResultSnapshot(
            List.of("10.20.0.10", "10.20.0.7", "10.20.0.8"),
            List.of(neighbor),
            List.of(new DnsEntry("access-sw1", "10.20.0.10"), DnsEntry.failed("ghost-sw")),
            Map.of("10.20.0.8", "netops"),
            connectionErrors
        );
    }

    private static List<CSVRecord> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.builder()
                 .setHeader()
                 .setSkipHeaderRecord(true)
                 .build()
                 .parse(reader)) {
            return parser.getRecords();
        }
    }
}
