package com.eainde.nsgx.proposal;

import com.eainde.nsgx.model.Candidate;

import java.util.ArrayList;
import java.util.List;

/**
 * All observations of one normalized key within one category, in first-seen order.
 */
final class KeyGroup {

    /** One candidate as found in one document. */
    record Observation(Candidate candidate, String documentId) {}

    private final String category;
    private final String key;
    private final List<Observation> observations = new ArrayList<>();

    KeyGroup(String category, String key) {
        this.category = category;
        this.key = key;
    }

    void add(Candidate candidate, String documentId) {
        observations.add(new Observation(candidate, documentId));
    }

    String category() {
        return category;
    }

    String key() {
        return key;
    }

    List<Observation> observations() {
        return observations;
    }

    /**
     * @return the most confident candidate; the first one on ties
     */
    Candidate representative() {
        return representativeOf(observations);
    }

    static Candidate representativeOf(List<Observation> observations) {
        Candidate best = null;
        for (Observation observation : observations) {
            if (best == null || observation.candidate().confidence() > best.confidence()) {
                best = observation.candidate();
            }
        }
        return best;
    }
}
