package com.netaudit.topology.discovery.model;

public record DnsEntry(String hostname, String address) {
    public static final String DNS_FAILURE = "DNS_FAILURE";

    public static DnsEntry failed(String hostname) {
        return new DnsEntry(hostname, DNS_FAILURE);
    }

    public boolean resolved() {
        return address != null && !DNS_FAILURE.equals(address);
    }
}
