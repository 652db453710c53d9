package com.eainde.nsgx.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated payload of one extraction call: rules plus new vocabulary candidates
 * per category. This is also the value stored in the result cache.
 */
public record StructuredResult(
        @JsonProperty("rules")          List<Fact> facts,
        @JsonProperty("new_candidates") Map<String, List<Candidate>> candidates
) {

    public StructuredResult {
        facts = facts == null ? List.of() : List.copyOf(facts);
        Map<String, List<Candidate>> copy = new LinkedHashMap<>();
        if (candidates != null) {
            candidates.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        }
        candidates = Collections.unmodifiableMap(copy);
    }

    public static StructuredResult empty() {
        return new StructuredResult(List.of(), Map.of());
    }

    /**
     * @return all candidates across categories
     */
    @JsonIgnore
    public List<Candidate> allCandidates() {
        return candidates.values().stream().flatMap(List::stream).toList();
    }
}
