package com.netaudit.topology.discovery.service;

import com.netaudit.topology.config.AuditorProperties;
import com.netaudit.topology.discovery.model.DiscoveryRunRequest;
import com.netaudit.topology.discovery.model.DiscoveryRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Component
public class DiscoveryCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryCliRunner.class);

    private final AuditorProperties properties;
    private final TopologyDiscoveryService topologyDiscoveryService;
    private final ConfigurableApplicationContext applicationContext;

    public DiscoveryCliRunner(
        AuditorProperties properties,
        TopologyDiscoveryService topologyDiscoveryService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.topologyDiscoveryService = topologyDiscoveryService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> seeds = parseSeeds(properties.getCli().getSeeds());
        DiscoveryRunRequest request = DiscoveryRunRequest.ofSeeds(seeds, properties.getCli().getSiteName());

        int exitCode;
        try {
            DiscoveryRunSummary summary = topologyDiscoveryService.run(request);
            log.info("Discovery run {} completed with status {}", summary.runId(), summary.status());
            for (Map.Entry<String, String> error : summary.connectionErrors().entrySet()) {
                log.info("Unreachable {}: {}", error.getKey(), error.getValue());
            }
            for (String file : summary.reportFiles()) {
                log.info("Report file {}", file);
            }
            exitCode = 0;
        } catch (DiscoveryPreflightException e) {
            log.error("Discovery not started: {}", e.getMessage());
            exitCode = 2;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            int code = SpringApplication.exit(applicationContext, () -> finalExitCode);
            System.exit(code);
        }
    }

    static List<String> parseSeeds(String raw) {
        if (raw == null) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
