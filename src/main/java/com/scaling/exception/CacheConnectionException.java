package com.scaling.exception;

/**
 * Transient failure talking to the key-value store (network error, pool exhaustion).
 * Never escapes the cache connection manager.
 */
public class CacheConnectionException extends ScalingException {

    public CacheConnectionException(String message) {
        super(message);
    }

    public CacheConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
