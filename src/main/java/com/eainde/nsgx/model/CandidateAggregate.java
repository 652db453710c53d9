package com.eainde.nsgx.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Corpus-wide verdict for one cluster of similar candidate keys.
 *
 * @param category           candidate category, e.g. {@code activities}
 * @param representativeText original text of the highest-confidence member
 * @param decision           verdict for the cluster
 * @param targetOrKey        catalog target (MAP_TO_EXISTING) or proposed key (ADD_NEW)
 * @param reason             human-readable justification
 * @param supportingDocCount distinct documents supporting the cluster
 * @param exampleQuote       shortest non-empty member quote
 * @param meanConfidence     arithmetic mean of member confidences
 * @param memberKeys         normalized keys absorbed into the cluster, first-seen order
 * @param documentIds        supporting documents, sorted
 */
public record CandidateAggregate(
        @JsonProperty("category")             String category,
        @JsonProperty("representative_text")  String representativeText,
        @JsonProperty("decision")             CandidateDecision decision,
        @JsonProperty("target_or_key")        String targetOrKey,
        @JsonProperty("reason")               String reason,
        @JsonProperty("supporting_doc_count") int supportingDocCount,
        @JsonProperty("example_quote")        String exampleQuote,
        @JsonProperty("mean_confidence")      double meanConfidence,
        @JsonProperty("member_keys")          List<String> memberKeys,
        @JsonProperty("document_ids")         List<String> documentIds
) {

    public CandidateAggregate {
        memberKeys = memberKeys == null ? List.of() : List.copyOf(memberKeys);
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
    }
}
