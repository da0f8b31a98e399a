package com.swingtrading.error;

/**
 * Broker rejected our credentials. Unrecoverable for a live run.
 */
public final class BrokerAuthenticationException extends ExternalServiceException {

    public BrokerAuthenticationException(String service, String message) {
        super(service, message);
    }
}
