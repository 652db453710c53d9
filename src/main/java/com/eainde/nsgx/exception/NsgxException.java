package com.eainde.nsgx.exception;

/**
 * Base type for failures the pipeline cannot recover from locally.
 */
public class NsgxException extends RuntimeException {

    public NsgxException(String message) {
        super(message);
    }

    public NsgxException(String message, Throwable cause) {
        super(message, cause);
    }
}
