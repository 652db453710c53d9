package com.eainde.nsgx.proposal;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String normalization shared by matching, clustering and key derivation.
 */
public final class CandidateNormalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]+");
    private static final Pattern NON_KEY = Pattern.compile("[^\\p{L}\\p{N}_]");

    /** Connectives and prepositions that carry no meaning for term identity. */
    private static final Set<String> STOP_WORDS = Set.of(
            "und", "oder", "sowie", "bzw", "mit", "ohne", "von", "zu", "bei",
            "in", "an", "auf", "unter", "ueber");

    private CandidateNormalizer() {
    }

    /**
     * Lowercases, transliterates umlauts, strips punctuation and drops stop words.
     * "Hunde über Land mitführen!" becomes "hunde land mitfuehren".
     */
    public static String normalizeForComparison(String text) {
        if (text == null) {
            return "";
        }
        String s = transliterate(text.toLowerCase(Locale.GERMAN));
        s = NON_WORD.matcher(s).replaceAll("");
        return Arrays.stream(WHITESPACE.split(s.strip()))
                .filter(token -> !token.isEmpty() && !STOP_WORDS.contains(token))
                .collect(Collectors.joining(" "));
    }

    /**
     * Derives a snake_case key: "Drohnen steigen lassen" becomes
     * {@code drohnen_steigen_lassen}. Keys never start with a digit.
     */
    public static String toSnakeCase(String text) {
        String s = SEPARATORS.matcher(normalizeForComparison(text)).replaceAll("_");
        s = NON_KEY.matcher(s).replaceAll("");
        if (!s.isEmpty() && Character.isDigit(s.charAt(0))) {
            s = "_" + s;
        }
        return s.toLowerCase(Locale.ROOT);
    }

    private static String transliterate(String s) {
        return s.replace("ä", "ae")
                .replace("ö", "oe")
                .replace("ü", "ue")
                .replace("ß", "ss");
    }
}
