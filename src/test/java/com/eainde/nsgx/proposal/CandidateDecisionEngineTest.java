package com.eainde.nsgx.proposal;

import com.eainde.nsgx.model.Candidate;
import com.eainde.nsgx.model.CandidateDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateDecisionEngineTest {

    private static final VocabularyCatalog CATALOG = VocabularyCatalog.of(Map.of(
            "aktivitaet", List.of("klettern", "radfahren", "wasserfahrzeuge_motorisiert"),
            "zone_typ", List.of("kernzone", "ruhezone"),
            "ort", List.of("pfade")));

    private final CandidateDecisionEngine engine =
            new CandidateDecisionEngine(CATALOG, QualifierHeuristics.defaults(), 80);

    private static Candidate candidate(String key, String text) {
        return Candidate.of(key, text, "quote", 0.8);
    }

    @Test
    @DisplayName("should map an exact key match to the existing value")
    void exactMatch() {
        Verdict verdict = engine.decide("activities", "klettern", candidate("klettern", "Klettern"));

        assertThat(verdict.decision()).isEqualTo(CandidateDecision.MAP_TO_EXISTING);
        assertThat(verdict.target()).isEqualTo("klettern");
        assertThat(verdict.reason()).isEqualTo("Exact match with existing enum value");
    }

    @Test
    @DisplayName("should map a similar text to the best matching value")
    void fuzzyMatch() {
        Verdict verdict = engine.decide("place_terms", "pfad", candidate("pfad", "Pfade!"));

        assertThat(verdict.decision()).isEqualTo(CandidateDecision.MAP_TO_EXISTING);
        assertThat(verdict.target()).isEqualTo("pfade");
        assertThat(verdict.reason()).startsWith("High similarity match (score: 100.0");
    }

    @Test
    @DisplayName("should map an activity with a qualifier to its base activity")
    void qualifiedActivity() {
        Verdict verdict = engine.decide("activities", "klettern_in_gruppen",
                candidate("klettern_in_gruppen", "Klettern in Gruppen"));

        assertThat(verdict.decision()).isEqualTo(CandidateDecision.MAP_TO_EXISTING);
        assertThat(verdict.target()).isEqualTo("klettern");
        assertThat(verdict.reason()).isEqualTo("Can be represented as existing activity + conditions");
    }

    @Test
    @DisplayName("should apply the qualifier check to activities only")
    void qualifierOnlyForActivities() {
        Verdict verdict = engine.decide("zone_terms", "kernzone_nacht",
                candidate("kernzone_nacht", "Kernzone bei Nacht"));

        assertThat(verdict.isProvisionalNew()).isTrue();
    }

    @Test
    @DisplayName("should mark an unmatched term as provisionally new")
    void provisionalNew() {
        Verdict verdict = engine.decide("activities", "geocaching", candidate("geocaching", "Geocaching"));

        assertThat(verdict.isProvisionalNew()).isTrue();
        assertThat(verdict.target()).isNull();
    }

    @Test
    @DisplayName("should ignore categories the catalog does not cover")
    void unknownCategory() {
        Verdict verdict = engine.decide("species", "biber", candidate("biber", "Biber"));

        assertThat(verdict.decision()).isEqualTo(CandidateDecision.IGNORE);
        assertThat(verdict.reason()).contains("Unknown category: species");
    }
}
