package com.eainde.nsgx.exception;

public class CatalogLoadException extends NsgxException {

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
