package com.netaudit.topology.discovery.model;

public record CredentialPair(String username, String password) {

    public boolean isComplete() {
        return username != null && !username.isBlank() && password != null && !password.isEmpty();
    }

    @Override
    public String toString() {
        return "CredentialPair[username=" + username + ", password=****]";
    }
}
