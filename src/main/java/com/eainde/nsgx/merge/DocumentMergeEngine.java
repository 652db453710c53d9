package com.eainde.nsgx.merge;

import com.eainde.nsgx.model.Candidate;
import com.eainde.nsgx.model.Condition;
import com.eainde.nsgx.model.DocumentResult;
import com.eainde.nsgx.model.Fact;
import com.eainde.nsgx.model.FactKey;
import com.eainde.nsgx.model.UnitResult;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines all unit results of one document into a {@link DocumentResult}.
 * Java-only; no service call.
 *
 * <h3>Merge rules:</h3>
 * <ol>
 *   <li>Conditions are canonicalized first (PS limits become kW).</li>
 *   <li>Facts are grouped by (activity, place, permission, zone); single facts pass
 *       through.</li>
 *   <li>Duplicates: citations are unioned and sorted, confidence is the maximum,
 *       distinct normalization reasons are joined, conditions merge through
 *       {@link ConditionMerger}.</li>
 *   <li>Candidates merge through {@link CandidateMerger}.</li>
 * </ol>
 *
 * <p>The merge is commutative: any permutation of the same unit results yields an
 * equal document result.</p>
 */
@Log4j2
public class DocumentMergeEngine {

    static final String REASON_SEPARATOR = "; ";

    private static final Comparator<String> TEXT = Comparator.nullsFirst(Comparator.<String>naturalOrder());

    /** Total order over facts sharing a key, so the merged fact does not depend on arrival order. */
    private static final Comparator<Fact> FACT_ORDER = Comparator
            .comparingDouble(Fact::confidence).reversed()
            .thenComparing(Fact::normalizationReason, TEXT)
            .thenComparing(f -> f.citations().toString())
            .thenComparing(f -> f.conditions().toString())
            .thenComparing(f -> String.valueOf(f.zone()));

    private final ConditionMerger conditionMerger;
    private final ConditionCanonicalizer canonicalizer;
    private final CandidateMerger candidateMerger;

    public DocumentMergeEngine(ConditionMerger conditionMerger,
                               ConditionCanonicalizer canonicalizer,
                               CandidateMerger candidateMerger) {
        this.conditionMerger = conditionMerger;
        this.canonicalizer = canonicalizer;
        this.candidateMerger = candidateMerger;
    }

    /**
     * Merges the unit results of one document.
     *
     * @param documentId  document the results belong to
     * @param unitResults results in any order
     */
    public DocumentResult merge(String documentId, List<UnitResult> unitResults) {
        Map<FactKey, List<Fact>> byKey = new TreeMap<>();
        List<Map<String, List<Candidate>>> candidates = new ArrayList<>();
        int factsIn = 0;

        for (UnitResult unit : unitResults) {
            if (!documentId.equals(unit.documentId())) {
                throw new IllegalArgumentException("Unit " + unit.unitId() + " belongs to "
                        + unit.documentId() + ", not " + documentId);
            }
            for (Fact fact : unit.facts()) {
                Fact canonical = fact.withConditions(canonicalizer.canonicalize(fact.conditions()));
                byKey.computeIfAbsent(canonical.key(), k -> new ArrayList<>()).add(canonical);
                factsIn++;
            }
            candidates.add(unit.candidates());
        }

        List<Fact> merged = new ArrayList<>(byKey.size());
        for (List<Fact> group : byKey.values()) {
            merged.add(group.size() == 1 ? group.get(0) : mergeFacts(group));
        }

        DocumentResult result = new DocumentResult(documentId, unitResults.size(), merged,
                candidateMerger.merge(candidates));
        log.debug("Merged {}: {} units, {} -> {} rules, {} candidates",
                documentId, unitResults.size(), factsIn, merged.size(), result.candidateCount());
        return result;
    }

    /**
     * Convenience overload taking the document id from the first result.
     */
    public DocumentResult merge(List<UnitResult> unitResults) {
        if (unitResults.isEmpty()) {
            throw new IllegalArgumentException("Cannot infer document id from an empty result list");
        }
        return merge(unitResults.get(0).documentId(), unitResults);
    }

    private Fact mergeFacts(List<Fact> group) {
        List<Fact> ordered = new ArrayList<>(group);
        ordered.sort(FACT_ORDER);
        Fact base = ordered.get(0);

        Set<String> citations = new TreeSet<>();
        Set<String> reasons = new TreeSet<>();
        List<Condition> conditions = new ArrayList<>();
        double confidence = 0.0;
        for (Fact fact : ordered) {
            citations.addAll(fact.citations());
            if (fact.normalizationReason() != null && !fact.normalizationReason().isBlank()) {
                reasons.add(fact.normalizationReason());
            }
            conditions.addAll(fact.conditions());
            confidence = Math.max(confidence, fact.confidence());
        }

        return new Fact(
                base.activity(),
                base.place(),
                base.permission(),
                base.zone(),
                conditionMerger.merge(conditions),
                new ArrayList<>(citations),
                confidence,
                String.join(REASON_SEPARATOR, reasons));
    }
}
