package com.eainde.nsgx.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Verdict on a vocabulary candidate.
 */
public enum CandidateDecision {

    /** Genuinely new term; propose it as a catalog addition. */
    ADD_NEW,

    /** Already representable by an existing catalog value. */
    MAP_TO_EXISTING,

    /** Not worth proposing (too rare, unknown category, noise). */
    IGNORE,

    /** Service could not decide; triggers escalation to the thorough model. */
    UNSURE;

    /**
     * Lenient lookup for labels returned by the extraction service.
     *
     * @return the matching decision, or empty if the label is blank or unknown
     */
    public static Optional<CandidateDecision> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
