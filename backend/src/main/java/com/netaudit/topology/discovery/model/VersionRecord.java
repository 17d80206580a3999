package com.netaudit.topology.discovery.model;

public record VersionRecord(String hostname, String softwareVersion, String uptime, String serial) {

    public static VersionRecord unknown() {
        return new VersionRecord(null, null, null, null);
    }
}
