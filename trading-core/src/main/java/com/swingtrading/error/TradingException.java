package com.swingtrading.error;

/**
 * Root of the engine's unchecked exception hierarchy.
 */
public class TradingException extends RuntimeException {

    public TradingException(String message) {
        super(message);
    }

    public TradingException(String message, Throwable cause) {
        super(message, cause);
    }
}
