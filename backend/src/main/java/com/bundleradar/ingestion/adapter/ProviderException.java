package com.bundleradar.ingestion.adapter;

/**
 * Thrown when an upstream data provider call fails (HTTP error, timeout, local limiter).
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
