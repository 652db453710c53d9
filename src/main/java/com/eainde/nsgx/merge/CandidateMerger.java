package com.eainde.nsgx.merge;

import com.eainde.nsgx.model.Candidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Unions candidates across units by category and collapses duplicates of the same
 * {@code key_snake}.
 *
 * <h3>Merge rules:</h3>
 * <ol>
 *   <li>Text, decision and target come from the most confident duplicate.</li>
 *   <li>Distinct quotes are joined with {@value #SEPARATOR} and capped.</li>
 *   <li>Distinct supporting reasons are joined the same way.</li>
 *   <li>Confidence is the maximum.</li>
 * </ol>
 */
public class CandidateMerger {

    static final String SEPARATOR = "; ";

    private static final Comparator<String> TEXT = Comparator.nullsFirst(Comparator.<String>naturalOrder());

    private static final Comparator<Candidate> MOST_CONFIDENT_FIRST = Comparator
            .comparingDouble(Candidate::confidence).reversed()
            .thenComparing(Candidate::originalText, TEXT)
            .thenComparing(Candidate::quote, TEXT)
            .thenComparing(Candidate::supportingReason, TEXT)
            .thenComparing(c -> c.decision() == null ? null : c.decision().name(), TEXT)
            .thenComparing(Candidate::targetOrKey, TEXT);

    private final int quoteMaxLength;

    public CandidateMerger(int quoteMaxLength) {
        this.quoteMaxLength = quoteMaxLength;
    }

    /**
     * @return categories sorted by name, candidates sorted by key
     */
    public Map<String, List<Candidate>> merge(List<Map<String, List<Candidate>>> perUnit) {
        Map<String, Map<String, List<Candidate>>> grouped = new TreeMap<>();
        for (Map<String, List<Candidate>> unitCandidates : perUnit) {
            unitCandidates.forEach((category, candidates) -> {
                Map<String, List<Candidate>> byKey = grouped.computeIfAbsent(category, k -> new TreeMap<>());
                for (Candidate candidate : candidates) {
                    byKey.computeIfAbsent(candidate.normalizedKey(), k -> new ArrayList<>()).add(candidate);
                }
            });
        }

        Map<String, List<Candidate>> merged = new TreeMap<>();
        grouped.forEach((category, byKey) -> {
            List<Candidate> list = new ArrayList<>();
            byKey.values().forEach(duplicates -> list.add(collapse(duplicates)));
            merged.put(category, list);
        });
        return merged;
    }

    private Candidate collapse(List<Candidate> duplicates) {
        if (duplicates.size() == 1) {
            return duplicates.get(0);
        }
        List<Candidate> ordered = new ArrayList<>(duplicates);
        ordered.sort(MOST_CONFIDENT_FIRST);
        Candidate best = ordered.get(0);

        String quotes = joinDistinct(ordered.stream().map(Candidate::quote).toList());
        if (quotes.codePointCount(0, quotes.length()) > quoteMaxLength) {
            quotes = quotes.substring(0, quotes.offsetByCodePoints(0, quoteMaxLength));
        }
        String reasons = joinDistinct(ordered.stream().map(Candidate::supportingReason).toList());

        return new Candidate(
                best.normalizedKey(),
                best.originalText(),
                quotes,
                best.confidence(),
                reasons.isEmpty() ? null : reasons,
                best.decision(),
                best.targetOrKey());
    }

    private static String joinDistinct(List<String> values) {
        Set<String> distinct = new LinkedHashSet<>();
        values.stream().filter(Objects::nonNull).filter(v -> !v.isBlank()).forEach(distinct::add);
        return String.join(SEPARATOR, distinct);
    }
}
