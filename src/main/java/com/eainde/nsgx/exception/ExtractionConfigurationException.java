package com.eainde.nsgx.exception;

/**
 * Missing or invalid service configuration (endpoint, API key, model name).
 * Fatal at startup; never retried.
 */
public class ExtractionConfigurationException extends NsgxException {

    public ExtractionConfigurationException(String message) {
        super(message);
    }
}
