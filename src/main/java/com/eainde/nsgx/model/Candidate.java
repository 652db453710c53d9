package com.eainde.nsgx.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A term observed in regulation text that the known catalog does not contain.
 *
 * @param normalizedKey    snake_case key; equality key within a category
 * @param originalText     term as written in the document
 * @param quote            supporting quote from the text
 * @param confidence       service confidence in [0, 1]
 * @param supportingReason why the service believes the term is new; may be null
 * @param decision         the service's own verdict, if it returned one
 * @param targetOrKey      catalog target suggested by the service, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Candidate(
        @JsonProperty("key_snake")     String normalizedKey,
        @JsonProperty("original")      String originalText,
        @JsonProperty("quote")         String quote,
        @JsonProperty("confidence")    double confidence,
        @JsonProperty("why_new")       String supportingReason,
        @JsonProperty("decision")      CandidateDecision decision,
        @JsonProperty("target_or_key") String targetOrKey
) {

    public static Candidate of(String normalizedKey, String originalText, String quote, double confidence) {
        return new Candidate(normalizedKey, originalText, quote, confidence, null, null, null);
    }
}
