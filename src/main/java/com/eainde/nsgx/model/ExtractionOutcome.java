package com.eainde.nsgx.model;

import java.util.List;

/**
 * Result of one extraction call: either a validated {@link StructuredResult} or a
 * typed failure.
 */
public sealed interface ExtractionOutcome permits ExtractionOutcome.Success, ExtractionOutcome.Failure {

    static ExtractionOutcome success(StructuredResult result, List<DroppedEntry> dropped) {
        return new Success(result, dropped);
    }

    static ExtractionOutcome failure(FailureKind kind, String message, String rawContent) {
        return new Failure(kind, message, rawContent);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @param result  validated payload
     * @param dropped entries removed by validation; the rest of the payload is usable
     */
    record Success(StructuredResult result, List<DroppedEntry> dropped) implements ExtractionOutcome {
        public Success {
            dropped = dropped == null ? List.of() : List.copyOf(dropped);
        }
    }

    /**
     * @param kind       failure category
     * @param message    diagnostic message (status line, parse error, ...)
     * @param rawContent raw body or message content for diagnosis; may be null
     */
    record Failure(FailureKind kind, String message, String rawContent) implements ExtractionOutcome {}
}
