package com.netaudit.topology.discovery.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class DiscoveryPreflightException extends RuntimeException {
    public DiscoveryPreflightException(String message) {
        super(message);
    }

    public DiscoveryPreflightException(String message, Throwable cause) {
        super(message, cause);
    }
}
