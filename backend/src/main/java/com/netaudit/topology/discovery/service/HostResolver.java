package com.netaudit.topology.discovery.service;

import com.netaudit.topology.discovery.model.DnsEntry;
import com.netaudit.topology.discovery.util.HostAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;

@Service
public class HostResolver {
    private static final Logger log = LoggerFactory.getLogger(HostResolver.class);

    private final AddressLookup lookup;

    @Autowired
    public HostResolver() {
        this(hostname -> InetAddress.getByName(hostname).getHostAddress());
    }

    HostResolver(AddressLookup lookup) {
        this.lookup = lookup;
    }

    /**
     * Resolves a DNS name to an address. Address literals come back unchanged.
     */
    public DnsEntry resolve(String hostname) {
        String name = hostname == null ? "" : hostname.trim();
        if (HostAddresses.isAddressLiteral(name)) {
            return new DnsEntry(name, name);
        }
        if (!HostAddresses.isHostname(name)) {
            log.warn("Seed {} is neither an address nor a valid hostname", name);
            return DnsEntry.failed(name);
        }
        try {
            String address = lookup.resolve(name);
            if (address == null || address.isBlank()) {
                return DnsEntry.failed(name);
            }
            log.debug("Resolved {} to {}", name, address);
            return new DnsEntry(name, address);
        } catch (UnknownHostException e) {
            log.warn("DNS resolution failed for {}", name);
            return DnsEntry.failed(name);
        }
    }

    @FunctionalInterface
    interface AddressLookup {
        String resolve(String hostname) throws UnknownHostException;
    }
}
