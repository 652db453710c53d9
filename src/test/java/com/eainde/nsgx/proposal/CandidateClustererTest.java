package com.eainde.nsgx.proposal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateClustererTest {

    private final CandidateClusterer clusterer = new CandidateClusterer(80);

    private static KeyGroup group(String key) {
        return new KeyGroup("activities", key);
    }

    private static List<List<String>> keys(List<List<KeyGroup>> clusters) {
        return clusters.stream().map(c -> c.stream().map(KeyGroup::key).toList()).toList();
    }

    @Test
    @DisplayName("should cluster singular and plural variants of the same term")
    void variants() {
        List<List<KeyGroup>> clusters = clusterer.cluster(List.of(
                group("drohnen_steigen_lassen"), group("geocaching"), group("drohne_steigen_lassen")));

        assertThat(keys(clusters)).containsExactly(
                List.of("drohnen_steigen_lassen", "drohne_steigen_lassen"),
                List.of("geocaching"));
    }

    @Test
    @DisplayName("should compare against the seed only, so visiting order shapes the partition")
    void greedySeed() {
        KeyGroup a = group("abcde");
        KeyGroup b = group("abcdx");
        KeyGroup c = group("abcxy");

        assertThat(keys(clusterer.cluster(List.of(a, b, c))))
                .containsExactly(List.of("abcde", "abcdx"), List.of("abcxy"));
        assertThat(keys(clusterer.cluster(List.of(b, a, c))))
                .containsExactly(List.of("abcdx", "abcde", "abcxy"));
    }

    @Test
    @DisplayName("should never cluster across categories")
    void categories() {
        List<List<KeyGroup>> clusters = clusterer.cluster(List.of(
                new KeyGroup("activities", "bohlenweg"), new KeyGroup("place_terms", "bohlenweg")));

        assertThat(clusters).hasSize(2);
    }
}
