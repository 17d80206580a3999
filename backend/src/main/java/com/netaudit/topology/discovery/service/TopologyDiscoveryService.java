package com.netaudit.topology.discovery.service;

import com.netaudit.topology.config.AuditorProperties;
import com.netaudit.topology.discovery.frontier.Frontier;
import com.netaudit.topology.discovery.model.BastionHost;
import com.netaudit.topology.discovery.model.ConnectionErrorKind;
import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.DiscoveryRunRequest;
import com.netaudit.topology.discovery.model.DiscoveryRunSummary;
import com.netaudit.topology.discovery.model.DnsEntry;
import com.netaudit.topology.discovery.model.ResultSnapshot;
import com.netaudit.topology.discovery.model.RunConfig;
import com.netaudit.topology.discovery.parse.OutputParser;
import com.netaudit.topology.discovery.parse.TemplateUnavailableException;
import com.netaudit.topology.discovery.report.DiscoveryReportWriter;
import com.netaudit.topology.discovery.util.HostAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one discovery at a time: pre-flight checks, seeding, the worker pool, quiescence,
 * shutdown, then the report and the summary.
 */
@Service
public class TopologyDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(TopologyDiscoveryService.class);
    private static final Duration PROGRESS_LOG_INTERVAL = Duration.ofSeconds(30);
    private static final Duration WORKER_JOIN_GRACE = Duration.ofSeconds(5);
    private static final String NO_BASTION = "none";

    private final AuditorProperties properties;
    private final HostResolver hostResolver;
    private final HostDiscoverer hostDiscoverer;
    private final OutputParser outputParser;
    private final DiscoveryReportWriter reportWriter;
    private final ExecutorService discoveryRunExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<DiscoveryRunSummary> lastSummary = new AtomicReference<>();

    public TopologyDiscoveryService(
        AuditorProperties properties,
        HostResolver hostResolver,
        HostDiscoverer hostDiscoverer,
        OutputParser outputParser,
        DiscoveryReportWriter reportWriter,
        @Qualifier("discoveryRunExecutor") ExecutorService discoveryRunExecutor
    ) {
        this.properties = properties;
        this.hostResolver = hostResolver;
        this.hostDiscoverer = hostDiscoverer;
        this.outputParser = outputParser;
        this.reportWriter = reportWriter;
        this.discoveryRunExecutor = discoveryRunExecutor;
    }

    public DiscoveryRunSummary run(DiscoveryRunRequest request) {
        ensureNoActiveRun();
        try {
            return execute(prepare(request));
        } finally {
            running.set(false);
        }
    }

    /**
     * Runs pre-flight checks on the caller's thread, then discovery on the run executor.
     *
     * @return id of the started run
     */
    public String startAsync(DiscoveryRunRequest request) {
        ensureNoActiveRun();
        PreparedRun prepared;
        try {
            prepared = prepare(request);
            discoveryRunExecutor.submit(() -> {
                try {
                    execute(prepared);
                } catch (Exception e) {
                    log.warn("Discovery run {} failed", prepared.runId(), e);
                } finally {
                    running.set(false);
                }
            });
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return prepared.runId();
    }

    public boolean isRunning() {
        return running.get();
    }

    public DiscoveryRunSummary lastSummary() {
        return lastSummary.get();
    }

    private void ensureNoActiveRun() {
        if (!running.compareAndSet(false, true)) {
            DiscoveryRunSummary previous = lastSummary.get();
            throw new ActiveDiscoveryRunException(
                "Active discovery run in progress (last completed run="
                    + (previous == null ? "none" : previous.runId()) + ")"
            );
        }
    }

    PreparedRun prepare(DiscoveryRunRequest request) {
        if (request == null) {
            throw new DiscoveryPreflightException("discovery request is required");
        }
        List<String> seeds = request.normalizedSeeds();
        if (seeds.isEmpty()) {
            throw new DiscoveryPreflightException("at least one seed host is required");
        }

        List<DnsEntry> dnsEntries = new ArrayList<>();
        Set<String> seedAddresses = new LinkedHashSet<>();
        for (String seed : seeds) {
            if (HostAddresses.isAddressLiteral(seed)) {
                seedAddresses.add(seed);
                continue;
            }
            DnsEntry entry = hostResolver.resolve(seed);
            dnsEntries.add(entry);
            if (entry.resolved()) {
                seedAddresses.add(entry.address());
            }
        }
        if (seedAddresses.isEmpty()) {
            throw new DiscoveryPreflightException("seed hosts could not be resolved: " + seeds);
        }

        List<CredentialPair> credentials = credentialsFor(request);
        BastionHost bastion = bastionFor(request, credentials.get(0));

        try {
            outputParser.requireTemplate(properties.getTemplates().getNeighbors());
            outputParser.requireTemplate(properties.getTemplates().getVersion());
        } catch (TemplateUnavailableException e) {
            throw new DiscoveryPreflightException("parse template unavailable: " + e.getMessage(), e);
        }

        boolean writeReport = request.writeReport() == null
            ? properties.getReport().isEnabled()
            : request.writeReport();
        if (writeReport) {
            try {
                reportWriter.verifyDestination();
            } catch (IOException e) {
                throw new DiscoveryPreflightException("report destination unusable: " + e.getMessage(), e);
            }
        }

        String siteName = request.siteName() == null || request.siteName().isBlank()
            ? properties.getReport().getSiteName()
            : request.siteName().trim();

        RunConfig config = new RunConfig(
            Duration.ofSeconds(properties.getTimeoutSeconds()),
            properties.getMaxAttempts(),
            properties.getWorkerCount(),
            Duration.ofMillis(properties.getPollIntervalMs()),
            Duration.ofMillis(properties.getRetryDelayMs()),
            properties.getSshPort(),
            bastion,
            credentials,
            properties.getErrorPolicy()
        );
        return new PreparedRun(UUID.randomUUID().toString(), siteName, List.copyOf(seedAddresses), List.copyOf(dnsEntries), config, writeReport);
    }

    private List<CredentialPair> credentialsFor(DiscoveryRunRequest request) {
        AuditorProperties.Credentials configured = properties.getCredentials();
        CredentialPair primary = request.credentials() != null
            ? request.credentials()
            : new CredentialPair(configured.getUsername(), configured.getPassword());
        if (!primary.isComplete()) {
            throw new DiscoveryPreflightException("device credentials (username and password) are required");
        }
        List<CredentialPair> credentials = new ArrayList<>();
        credentials.add(primary);
        if (configured.isRetryAuthWithAlternate()) {
            CredentialPair alternate = request.alternateCredentials() != null
                ? request.alternateCredentials()
                : new CredentialPair(configured.getAlternateUsername(), configured.getAlternatePassword());
            if (alternate.isComplete() && !alternate.equals(primary)) {
                credentials.add(alternate);
            }
        }
        return credentials;
    }

    private BastionHost bastionFor(DiscoveryRunRequest request, CredentialPair deviceCredentials) {
        AuditorProperties.Bastion configured = properties.getBastion();
        String host = request.bastionHost() != null ? request.bastionHost().trim() : configured.getHost();
        if (host == null || host.isBlank() || NO_BASTION.equalsIgnoreCase(host.trim())) {
            return null;
        }
        CredentialPair bastionCredentials = new CredentialPair(configured.getUsername(), configured.getPassword());
        if (!bastionCredentials.isComplete()) {
            bastionCredentials = deviceCredentials;
        }
        return new BastionHost(host.trim(), configured.getPort(), bastionCredentials);
    }

    private DiscoveryRunSummary execute(PreparedRun run) {
        Instant startedAt = Instant.now();
        RunConfig config = run.config();
        log.info(
            "Discovery run {} for site {} starting: seeds={}, workers={}, timeout={}s, bastion={}",
            run.runId(),
            run.siteName(),
            run.seeds(),
            config.workerCount(),
            config.timeout().toSeconds(),
            config.viaBastion() ? config.bastion().host() : "none"
        );

        Frontier frontier = new Frontier();
        ResultStore store = new ResultStore();
        run.dnsEntries().forEach(store::addDnsEntry);
        for (String seed : run.seeds()) {
            frontier.tryEnqueue(seed);
        }

        DiscoveryWorkerPool pool = new DiscoveryWorkerPool(frontier, store, hostDiscoverer, config);
        String status = "COMPLETED";
        pool.start();
        try {
            if (!awaitQuiescence(frontier, pool)) {
                status = "ABORTED";
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = "INTERRUPTED";
        } finally {
            pool.shutdown();
            joinWorkers(pool, config);
        }

        ResultSnapshot snapshot = store.snapshot(frontier.visitedSnapshot());
        if ("COMPLETED".equals(status) && snapshot.connectionErrorCount() > 0) {
            status = "COMPLETED_WITH_ERRORS";
        }

        List<String> reportFiles = List.of();
        boolean reportWritten = false;
        if (run.writeReport()) {
            try {
                reportFiles = reportWriter.write(run.siteName(), snapshot);
                reportWritten = true;
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to write discovery report for site {}", run.siteName(), e);
            }
        }

        Map<String, String> connectionErrors = new LinkedHashMap<>();
        snapshot.connectionErrors().forEach((host, kind) -> connectionErrors.put(host, kind.label()));
        DiscoveryRunSummary summary = new DiscoveryRunSummary(
            run.runId(),
            run.siteName(),
            startedAt,
            Instant.now(),
            status,
            snapshot.visitedCount(),
            snapshot.authErrorCount(),
            snapshot.connectionErrorCount(),
            snapshot.neighbors().size(),
            connectionErrors,
            reportWritten,
            reportFiles
        );
        log.info(
            "Discovery run {} finished with status {}: visited={}, authErrors={}, connectionErrors={} (timeout={}, unexpected={}), neighborRows={}",
            run.runId(),
            status,
            snapshot.visitedCount(),
            snapshot.authErrorCount(),
            snapshot.connectionErrorCount(),
            snapshot.countByKind(ConnectionErrorKind.TIMEOUT_ERROR),
            snapshot.countByKind(ConnectionErrorKind.UNEXPECTED_ERROR),
            snapshot.neighbors().size()
        );
        lastSummary.set(summary);
        return summary;
    }

    private boolean awaitQuiescence(Frontier frontier, DiscoveryWorkerPool pool) throws InterruptedException {
        while (!frontier.awaitQuiescence(PROGRESS_LOG_INTERVAL)) {
            if (pool.liveWorkers() == 0) {
                log.error("All discovery workers exited with {} hosts outstanding", frontier.outstandingCount());
                return false;
            }
            log.info(
                "Discovery progress: visited={}, queued={}, outstanding={}",
                frontier.visitedSnapshot().size(),
                frontier.queuedCount(),
                frontier.outstandingCount()
            );
        }
        return true;
    }

    private void joinWorkers(DiscoveryWorkerPool pool, RunConfig config) {
        try {
            if (!pool.awaitTermination(WORKER_JOIN_GRACE.plus(config.pollInterval()))) {
                log.warn("Discovery workers did not exit within {}", WORKER_JOIN_GRACE.plus(config.pollInterval()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    record PreparedRun(
        String runId,
        String siteName,
        List<String> seeds,
        List<DnsEntry> dnsEntries,
        RunConfig config,
        boolean writeReport
    ) {
    }
}
