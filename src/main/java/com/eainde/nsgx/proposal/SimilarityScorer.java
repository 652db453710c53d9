package com.eainde.nsgx.proposal;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

/**
 * 0-100 string similarity based on the longest common subsequence.
 */
public final class SimilarityScorer {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private SimilarityScorer() {
    }

    /**
     * {@code 200 * lcs(a, b) / (|a| + |b|)}: 100 for identical strings, 0 for
     * strings with no character in common.
     */
    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 100.0;
        }
        return 200.0 * LCS.apply(a, b) / total;
    }

    /**
     * Best {@link #ratio} of the shorter string against every window of the same
     * length in the longer one.
     */
    public static double partialRatio(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        if (shorter.isEmpty()) {
            return longer.isEmpty() ? 100.0 : 0.0;
        }
        double best = 0.0;
        for (int start = 0; start + shorter.length() <= longer.length(); start++) {
            best = Math.max(best, ratio(shorter, longer.substring(start, start + shorter.length())));
            if (best == 100.0) {
                break;
            }
        }
        return best;
    }
}
