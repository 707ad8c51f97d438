package com.scaling.exception;

/**
 * Base exception for the scaling framework.
 */
public class ScalingException extends RuntimeException {

    public ScalingException(String message) {
        super(message);
    }

    public ScalingException(String message, Throwable cause) {
        super(message, cause);
    }
}
