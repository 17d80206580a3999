package com.netaudit.topology.discovery.parse;

public class TemplateUnavailableException extends RuntimeException {

    public TemplateUnavailableException(String message) {
        super(message);
    }

    public TemplateUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
