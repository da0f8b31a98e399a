package com.swingtrading.error;

/**
 * A broker, market-data or storage collaborator was unavailable or answered with garbage.
 */
public class ExternalServiceException extends TradingException {
    private final String service;

    public ExternalServiceException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public ExternalServiceException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
