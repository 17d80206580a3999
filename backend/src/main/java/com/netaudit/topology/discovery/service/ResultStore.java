package com.netaudit.topology.discovery.service;

import com.netaudit.topology.discovery.model.ConnectionErrorKind;
import com.netaudit.topology.discovery.model.DnsEntry;
import com.netaudit.topology.discovery.model.NeighborRecord;
import com.netaudit.topology.discovery.model.ResultSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Results of one run. Guarded by its own monitor, never the frontier's lock, and never held
 * across network I/O.
 */
public class ResultStore {
    private final Object lock = new Object();
    private final List<NeighborRecord> neighbors = new ArrayList<>();
    private final List<DnsEntry> dnsEntries = new ArrayList<>();
    private final Map<String, String> authErrors = new LinkedHashMap<>();
    private final Map<String, ConnectionErrorKind> connectionErrors = new LinkedHashMap<>();
    private final Set<String> succeeded = new LinkedHashSet<>();

    public void addNeighbors(List<NeighborRecord> rows) {
        synchronized (lock) {
            neighbors.addAll(rows);
        }
    }

    public void addDnsEntry(DnsEntry entry) {
        synchronized (lock) {
            dnsEntries.add(entry);
        }
    }

    public void recordSuccess(String host) {
        synchronized (lock) {
            succeeded.add(host);
        }
    }

    /**
     * Terminal error for a host. Authentication failures also land in the auth-error map with
     * the username that was last rejected.
     */
    public void recordConnectionError(String host, ConnectionErrorKind kind, String username) {
        synchronized (lock) {
            connectionErrors.put(host, kind);
            if (kind == ConnectionErrorKind.AUTHENTICATION_ERROR) {
                authErrors.put(host, username == null ? "" : username);
            }
        }
    }

    public int neighborCount() {
        synchronized (lock) {
            return neighbors.size();
        }
    }

    public Set<String> succeededHosts() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(succeeded));
        }
    }

    public ResultSnapshot snapshot(Collection<String> visitedHosts) {
        synchronized (lock) {
            return new ResultSnapshot(
                List.copyOf(visitedHosts),
                List.copyOf(neighbors),
                List.copyOf(dnsEntries),
                Collections.unmodifiableMap(new LinkedHashMap<>(authErrors)),
                Collections.unmodifiableMap(new LinkedHashMap<>(connectionErrors))
            );
        }
    }
}
