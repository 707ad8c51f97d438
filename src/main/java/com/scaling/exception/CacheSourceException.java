package com.scaling.exception;

/**
 * The source of truth behind a cache category failed to load or persist a value.
 * Unlike store failures, these reach the caller.
 */
public class CacheSourceException extends ScalingException {

    public CacheSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
