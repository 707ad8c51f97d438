package com.scaling.exception;

/**
 * A cached payload could not be encoded or decoded.
 */
public class CacheSerializationException extends ScalingException {

    public CacheSerializationException(String message) {
        super(message);
    }

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
