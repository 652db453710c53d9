package com.eainde.nsgx.proposal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityScorerTest {

    @Test
    @DisplayName("ratio should be 100 for identical and 0 for disjoint strings")
    void bounds() {
        assertThat(SimilarityScorer.ratio("klettern", "klettern")).isEqualTo(100.0);
        assertThat(SimilarityScorer.ratio("abc", "xyz")).isZero();
        assertThat(SimilarityScorer.ratio("", "")).isEqualTo(100.0);
    }

    @Test
    @DisplayName("ratio should score singular and plural keys above the clustering threshold")
    void pluralVariants() {
        double score = SimilarityScorer.ratio("drohnen_steigen_lassen", "drohne_steigen_lassen");

        assertThat(score).isCloseTo(200.0 * 21 / 43, within(1e-9));
        assertThat(score).isGreaterThanOrEqualTo(80.0);
    }

    @Test
    @DisplayName("ratio should be symmetric")
    void symmetric() {
        assertThat(SimilarityScorer.ratio("kitesurfen", "windsurfen"))
                .isEqualTo(SimilarityScorer.ratio("windsurfen", "kitesurfen"));
    }

    @Test
    @DisplayName("partialRatio should find the shorter string inside the longer one")
    void partial() {
        assertThat(SimilarityScorer.partialRatio("motorboot fahren", "boot")).isEqualTo(100.0);
        assertThat(SimilarityScorer.partialRatio("boot", "motorboot fahren")).isEqualTo(100.0);
        assertThat(SimilarityScorer.partialRatio("", "")).isEqualTo(100.0);
        assertThat(SimilarityScorer.partialRatio("", "boot")).isZero();
    }
}
