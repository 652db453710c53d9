package com.eainde.nsgx.proposal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateNormalizerTest {

    @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
    @CsvSource(delimiter = '|', value = {
            "Hunde über Land mitführen! | hunde land mitfuehren",
            "Angeln und Fischen         | angeln fischen",
            "Reiten an Stränden         | reiten straenden",
            "Fußweg                     | fussweg",
            "  Mehrfache    Leerzeichen | mehrfache leerzeichen"
    })
    @DisplayName("should normalize text for comparison")
    void normalizes(String input, String expected) {
        assertThat(CandidateNormalizer.normalizeForComparison(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should drop stop words only as whole tokens")
    void stopWordsAreTokens() {
        assertThat(CandidateNormalizer.normalizeForComparison("Mitfahren unter Wasser"))
                .isEqualTo("mitfahren wasser");
    }

    @Test
    @DisplayName("should treat null as empty")
    void nullIsEmpty() {
        assertThat(CandidateNormalizer.normalizeForComparison(null)).isEmpty();
        assertThat(CandidateNormalizer.toSnakeCase(null)).isEmpty();
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
            "Drohnen steigen lassen  | drohnen_steigen_lassen",
            "Stand-Up-Paddling       | stand_up_paddling",
            "drohnen_steigen_lassen  | drohnen_steigen_lassen",
            "10 km Radius            | _10_km_radius",
            "Übernachten im Freien   | uebernachten_im_freien"
    })
    @DisplayName("should derive snake_case keys")
    void snakeCase(String input, String expected) {
        assertThat(CandidateNormalizer.toSnakeCase(input)).isEqualTo(expected);
    }
}
