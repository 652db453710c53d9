package com.eainde.nsgx.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merged view of all unit results of one document. Derived; recomputing it from the
 * same unit results yields an equal value.
 *
 * @param documentId       document id
 * @param unitCount        number of unit results merged
 * @param factsMerged      deduplicated rules, ordered by equivalence key
 * @param candidatesMerged deduplicated candidates per category, categories and keys sorted
 */
public record DocumentResult(
        @JsonProperty("document_id")       String documentId,
        @JsonProperty("unit_count")        int unitCount,
        @JsonProperty("rules_merged")      List<Fact> factsMerged,
        @JsonProperty("candidates_merged") Map<String, List<Candidate>> candidatesMerged
) {

    public DocumentResult {
        factsMerged = factsMerged == null ? List.of() : List.copyOf(factsMerged);
        Map<String, List<Candidate>> sorted = new TreeMap<>();
        if (candidatesMerged != null) {
            candidatesMerged.forEach((category, list) -> sorted.put(category, List.copyOf(list)));
        }
        candidatesMerged = Collections.unmodifiableMap(sorted);
    }

    @JsonIgnore
    public int candidateCount() {
        return candidatesMerged.values().stream().mapToInt(List::size).sum();
    }
}
