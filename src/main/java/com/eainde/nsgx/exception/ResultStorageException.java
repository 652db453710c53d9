package com.eainde.nsgx.exception;

import com.eainde.nsgx.orchestration.BatchResult;

/**
 * Cache or output write failure. When raised by the orchestrator it carries the
 * batch result gathered so far, so produced unit results are never lost.
 */
public class ResultStorageException extends NsgxException {

    private final transient BatchResult partialResult;

    public ResultStorageException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public ResultStorageException(String message, Throwable cause, BatchResult partialResult) {
        super(message, cause);
        this.partialResult = partialResult;
    }

    /**
     * @return the batch result collected before the failure surfaced, or null
     */
    public BatchResult getPartialResult() {
        return partialResult;
    }
}
