package com.eainde.nsgx.model;

/**
 * A single rule or candidate entry discarded during response validation.
 *
 * @param section  {@code rules} or the candidate category it came from
 * @param index    position within that section
 * @param reason   first validation failure
 */
public record DroppedEntry(String section, int index, String reason) {}
