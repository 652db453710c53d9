package com.eainde.nsgx.exception;

public class DocumentSourceException extends NsgxException {

    public DocumentSourceException(String message) {
        super(message);
    }

    public DocumentSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
