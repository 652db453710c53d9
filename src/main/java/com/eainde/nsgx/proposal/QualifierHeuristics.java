package com.eainde.nsgx.proposal;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Detects activity candidates that are an existing activity plus a qualifier
 * ("Motorboot fahren", "Hunde in Gruppen ausführen") and therefore belong in a
 * condition, not in a new catalog value.
 *
 * <p>Both the qualifier list and the keyword fallbacks are domain judgment calls
 * and are injected from configuration.</p>
 */
public class QualifierHeuristics {

    public static final List<String> DEFAULT_QUALIFIERS = List.of(
            "elektrisch", "motor", "ps", "kw", "lang", "breit", "meter", "m",
            "personen", "gruppe", "winter", "sommer", "nacht", "tag",
            "schnell", "langsam", "groß", "klein", "leise", "laut");

    /** Keyword in the candidate text to suggested base activity; first hit wins. */
    public static final Map<String, String> DEFAULT_KEYWORD_FALLBACKS = defaultFallbacks();

    static final double PARTIAL_MATCH_THRESHOLD = 60.0;

    /** Qualifiers this short must be a whole token, optionally preceded by a number ("10ps"). */
    private static final int SHORT_QUALIFIER = 3;

    /** Candidate tokens shorter than this are not used to find the base activity. */
    private static final int MIN_BASE_TOKEN = 4;

    private final List<String> qualifiers;
    private final Map<String, String> keywordFallbacks;

    public QualifierHeuristics(List<String> qualifiers, Map<String, String> keywordFallbacks) {
        this.qualifiers = qualifiers.stream().map(q -> q.toLowerCase(Locale.GERMAN)).toList();
        this.keywordFallbacks = new LinkedHashMap<>(keywordFallbacks);
    }

    public static QualifierHeuristics defaults() {
        return new QualifierHeuristics(DEFAULT_QUALIFIERS, DEFAULT_KEYWORD_FALLBACKS);
    }

    /**
     * @return true if the text carries a qualifier and names a known activity
     */
    public boolean isQualifiedVariant(String originalText, List<String> knownActivities) {
        String text = originalText.toLowerCase(Locale.GERMAN);
        List<String> tokens = tokens(text);
        if (tokens.stream().noneMatch(this::isQualifier)) {
            return false;
        }
        for (String activity : knownActivities) {
            if (text.contains(activity) || text.contains(activity.replace('_', ' '))) {
                return true;
            }
            for (String token : tokens) {
                if (token.length() >= MIN_BASE_TOKEN && activity.contains(token)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Suggests the activity a qualified variant maps to: best partial match, then
     * keyword fallbacks, then the first known activity.
     */
    public Optional<String> suggestBaseActivity(String originalText, List<String> knownActivities) {
        String text = originalText.toLowerCase(Locale.GERMAN);
        String best = null;
        double bestScore = -1;
        for (String activity : knownActivities) {
            double score = SimilarityScorer.partialRatio(text, activity);
            if (score > bestScore) {
                bestScore = score;
                best = activity;
            }
        }
        if (best != null && bestScore >= PARTIAL_MATCH_THRESHOLD) {
            return Optional.of(best);
        }
        for (Map.Entry<String, String> fallback : keywordFallbacks.entrySet()) {
            if (text.contains(fallback.getKey())) {
                return Optional.of(fallback.getValue());
            }
        }
        return knownActivities.stream().findFirst();
    }

    private boolean isQualifier(String token) {
        for (String qualifier : qualifiers) {
            if (qualifier.length() <= SHORT_QUALIFIER) {
                if (token.equals(qualifier) || token.matches("\\d+(?:[.,]\\d+)?" + qualifier)) {
                    return true;
                }
            } else if (token.contains(qualifier)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> tokens(String text) {
        return Arrays.stream(text.split("[^\\p{L}\\p{N}]+"))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    private static Map<String, String> defaultFallbacks() {
        Map<String, String> fallbacks = new LinkedHashMap<>();
        fallbacks.put("motor", "wasserfahrzeuge_motorisiert");
        fallbacks.put("boot", "wasserfahrzeuge_ohne_motor");
        fallbacks.put("schiff", "wasserfahrzeuge_ohne_motor");
        fallbacks.put("paddle", "wasserfahrzeuge_ohne_motor");
        fallbacks.put("ruder", "wasserfahrzeuge_ohne_motor");
        fallbacks.put("fliegen", "drohnen_flugmodelle");
        fallbacks.put("luft", "drohnen_flugmodelle");
        fallbacks.put("drohne", "drohnen_flugmodelle");
        fallbacks.put("ballon", "drohnen_flugmodelle");
        return Collections.unmodifiableMap(fallbacks);
    }
}
