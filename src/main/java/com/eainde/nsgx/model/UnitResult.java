package com.eainde.nsgx.model;

import com.eainde.nsgx.chunk.TextUnit;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Output of processing one {@link TextUnit}. Write-once.
 *
 * @param documentId source document
 * @param unitId     unit within the document
 * @param model      model whose answer this is (the thorough one after escalation)
 * @param facts      extracted rules
 * @param candidates new vocabulary per category
 */
public record UnitResult(
        @JsonProperty("document_id") String documentId,
        @JsonProperty("unit_id")     String unitId,
        @JsonProperty("model")       String model,
        @JsonProperty("rules")       List<Fact> facts,
        @JsonProperty("new_candidates") Map<String, List<Candidate>> candidates
) {

    public UnitResult {
        facts = facts == null ? List.of() : List.copyOf(facts);
        candidates = new StructuredResult(List.of(), candidates).candidates();
    }

    public static UnitResult of(TextUnit unit, String model, StructuredResult result) {
        return new UnitResult(unit.documentId(), unit.unitId(), model,
                result.facts(), result.candidates());
    }
}
