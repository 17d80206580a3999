package com.netaudit.topology.discovery.model;

public record BastionHost(String host, int port, CredentialPair credentials) {
}
