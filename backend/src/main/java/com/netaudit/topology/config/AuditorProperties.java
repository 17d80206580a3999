package com.netaudit.topology.config;

import com.netaudit.topology.discovery.model.ErrorRecordingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "auditor")
public class AuditorProperties {
    public static final int MAX_ATTEMPTS = 3;

    private int timeoutSeconds = 10;
    private int workerCount = 8;
    private int pollIntervalMs = 200;
    private int retryDelayMs = 0;
    private int sshPort = 22;
    private ErrorRecordingPolicy errorPolicy = ErrorRecordingPolicy.LAST_WRITE_WINS;
    private Credentials credentials = new Credentials();
    private Bastion bastion = new Bastion();
    private Commands commands = new Commands();
    private Templates templates = new Templates();
    private NeighborFilter neighborFilter = new NeighborFilter();
    private Report report = new Report();
    private Cli cli = new Cli();

    public int getTimeoutSeconds() {
        return Math.max(1, timeoutSeconds);
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    /**
     * Attempts per host. Not configurable; kept as a getter so callers read it the same way as
     * every other run setting.
     */
    public int getMaxAttempts() {
        return MAX_ATTEMPTS;
    }

    public int getWorkerCount() {
        return Math.max(1, workerCount);
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = Math.max(1, workerCount);
    }

    public int getPollIntervalMs() {
        return Math.max(10, pollIntervalMs);
    }

    public void setPollIntervalMs(int pollIntervalMs) {
        this.pollIntervalMs = Math.max(10, pollIntervalMs);
    }

    public int getRetryDelayMs() {
        return Math.max(0, retryDelayMs);
    }

    public void setRetryDelayMs(int retryDelayMs) {
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    public int getSshPort() {
        return sshPort;
    }

    public void setSshPort(int sshPort) {
        this.sshPort = sshPort;
    }

    public ErrorRecordingPolicy getErrorPolicy() {
        return errorPolicy == null ? ErrorRecordingPolicy.LAST_WRITE_WINS : errorPolicy;
    }

    public void setErrorPolicy(ErrorRecordingPolicy errorPolicy) {
        this.errorPolicy = errorPolicy;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    public Bastion getBastion() {
        return bastion;
    }

    public void setBastion(Bastion bastion) {
        this.bastion = bastion;
    }

    public Commands getCommands() {
        return commands;
    }

    public void setCommands(Commands commands) {
        this.commands = commands;
    }

    public Templates getTemplates() {
        return templates;
    }

    public void setTemplates(Templates templates) {
        this.templates = templates;
    }

    public NeighborFilter getNeighborFilter() {
        return neighborFilter;
    }

    public void setNeighborFilter(NeighborFilter neighborFilter) {
        this.neighborFilter = neighborFilter;
    }

    public Report getReport() {
        return report;
    }

    public void setReport(Report report) {
        this.report = report;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Credentials {
        private String username;
        private String password;
        private String alternateUsername;
        private String alternatePassword;
        private boolean retryAuthWithAlternate = true;

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getAlternateUsername() {
            return alternateUsername;
        }

        public void setAlternateUsername(String alternateUsername) {
            this.alternateUsername = alternateUsername;
        }

        public String getAlternatePassword() {
            return alternatePassword;
        }

        public void setAlternatePassword(String alternatePassword) {
            this.alternatePassword = alternatePassword;
        }

        public boolean isRetryAuthWithAlternate() {
            return retryAuthWithAlternate;
        }

        public void setRetryAuthWithAlternate(boolean retryAuthWithAlternate) {
            this.retryAuthWithAlternate = retryAuthWithAlternate;
        }
    }

    public static class Bastion {
        private String host;
        private int port = 22;
        private String username;
        private String password;

        public boolean isEnabled() {
            return host != null && !host.isBlank();
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Commands {
        private String neighbors = "show cdp neighbors detail";
        private String version = "show version";

        public String getNeighbors() {
            return neighbors;
        }

        public void setNeighbors(String neighbors) {
            this.neighbors = neighbors;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }
    }

    public static class Templates {
        private String location = "classpath:templates/";
        private String neighbors = "cisco_ios_show_cdp_neighbors_detail.tpl";
        private String version = "cisco_ios_show_version.tpl";

        public String getLocation() {
            if (location == null || location.isBlank()) {
                return "classpath:templates/";
            }
            return location.endsWith("/") ? location : location + "/";
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getNeighbors() {
            return neighbors;
        }

        public void setNeighbors(String neighbors) {
            this.neighbors = neighbors;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }
    }

    public static class NeighborFilter {
        private List<String> requiredCapabilities = new ArrayList<>(List.of("Switch", "Router"));
        private List<String> excludedPlatformPrefixes = new ArrayList<>();

        public List<String> getRequiredCapabilities() {
            return requiredCapabilities == null ? List.of() : requiredCapabilities;
        }

        public void setRequiredCapabilities(List<String> requiredCapabilities) {
            this.requiredCapabilities = requiredCapabilities;
        }

        public List<String> getExcludedPlatformPrefixes() {
            return excludedPlatformPrefixes == null ? List.of() : excludedPlatformPrefixes;
        }

        public void setExcludedPlatformPrefixes(List<String> excludedPlatformPrefixes) {
            this.excludedPlatformPrefixes = excludedPlatformPrefixes;
        }
    }

    public static class Report {
        private boolean enabled = true;
        private String directory = "./reports";
        private String siteName = "site";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getSiteName() {
            return siteName == null || siteName.isBlank() ? "site" : siteName.trim();
        }

        public void setSiteName(String siteName) {
            this.siteName = siteName;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String seeds = "";
        private String siteName;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSeeds() {
            return seeds == null ? "" : seeds;
        }

        public void setSeeds(String seeds) {
            this.seeds = seeds;
        }

        public String getSiteName() {
            return siteName;
        }

        public void setSiteName(String siteName) {
            this.siteName = siteName;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
