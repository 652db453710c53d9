package com.eainde.nsgx.proposal;

import com.eainde.nsgx.model.Candidate;
import com.eainde.nsgx.model.CandidateDecision;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks a candidate against the known catalog, in priority order:
 * <ol>
 *   <li>key equals a known value: MAP_TO_EXISTING</li>
 *   <li>normalized text similar to a known value (score {@code >=} threshold): MAP_TO_EXISTING</li>
 *   <li>activities only: known activity plus a qualifier: MAP_TO_EXISTING to the base activity</li>
 *   <li>otherwise provisionally ADD_NEW; the document threshold is applied per cluster</li>
 * </ol>
 * Candidates of a category the catalog does not cover are IGNOREd.
 */
public class CandidateDecisionEngine {

    static final String ACTIVITIES = "activities";

    private final VocabularyCatalog catalog;
    private final QualifierHeuristics qualifierHeuristics;
    private final double similarityThreshold;

    public CandidateDecisionEngine(VocabularyCatalog catalog,
                                   QualifierHeuristics qualifierHeuristics,
                                   double similarityThreshold) {
        this.catalog = catalog;
        this.qualifierHeuristics = qualifierHeuristics;
        this.similarityThreshold = similarityThreshold;
    }

    Verdict decide(String category, String key, Candidate candidate) {
        Optional<List<String>> known = catalog.knownValues(category);
        if (known.isEmpty()) {
            return new Verdict(CandidateDecision.IGNORE, key, "Unknown category: " + category);
        }
        List<String> values = known.get();

        if (values.contains(key)) {
            return new Verdict(CandidateDecision.MAP_TO_EXISTING, key, "Exact match with existing enum value");
        }

        String normalized = CandidateNormalizer.normalizeForComparison(candidate.originalText());
        String bestValue = null;
        double bestScore = -1;
        for (String value : values) {
            double score = SimilarityScorer.ratio(normalized, CandidateNormalizer.normalizeForComparison(value));
            if (score > bestScore) {
                bestScore = score;
                bestValue = value;
            }
        }
        if (bestValue != null && bestScore >= similarityThreshold) {
            return new Verdict(CandidateDecision.MAP_TO_EXISTING, bestValue,
                    String.format(Locale.ROOT, "High similarity match (score: %.1f)", bestScore));
        }

        if (ACTIVITIES.equals(category) && qualifierHeuristics.isQualifiedVariant(candidate.originalText(), values)) {
            String base = qualifierHeuristics.suggestBaseActivity(candidate.originalText(), values).orElse(key);
            return new Verdict(CandidateDecision.MAP_TO_EXISTING, base,
                    "Can be represented as existing activity + conditions");
        }

        return Verdict.provisionalNew();
    }
}
