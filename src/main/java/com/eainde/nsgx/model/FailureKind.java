package com.eainde.nsgx.model;

/**
 * Why a unit produced no usable result.
 */
public enum FailureKind {
    /** Per-call time ceiling exceeded. */
    TIMEOUT,
    /** Connection refused, reset or otherwise broken at transport level. */
    CONNECTION,
    /** Non-success status other than 429. */
    HTTP_STATUS,
    /** Body or message content stayed empty after the capped retries. */
    EMPTY_CONTENT,
    /** Body present but not the expected nested JSON structure. */
    MALFORMED_RESPONSE,
    /** Worker interrupted while waiting out a rate-limit or retry delay. */
    INTERRUPTED,
    /** Result cache could not be read for the unit. */
    STORAGE,
    /** Any other runtime error raised while processing the unit. */
    UNEXPECTED
}
