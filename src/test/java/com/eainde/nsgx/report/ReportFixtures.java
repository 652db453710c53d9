package com.eainde.nsgx.report;

import com.eainde.nsgx.model.CandidateAggregate;
import com.eainde.nsgx.model.CandidateDecision;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class ReportFixtures {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    private ReportFixtures() {
    }

    static CandidateAggregate added(String category, String key, String text, int docs, double confidence) {
        return new CandidateAggregate(category, text, CandidateDecision.ADD_NEW, key,
                "Genuinely new term, appears in " + docs + " documents", docs,
                text + " ist verboten", confidence, List.of(key), List.of());
    }

    static CandidateAggregate mapped(String category, String text, String target) {
        return new CandidateAggregate(category, text, CandidateDecision.MAP_TO_EXISTING, target,
                "Exact match with existing enum value", 1, text, 0.9, List.of(target), List.of("NSG-0001-001"));
    }

    static CandidateAggregate ignored(String category, String key) {
        return new CandidateAggregate(category, key, CandidateDecision.IGNORE, key,
                "Insufficient document frequency (1 < 5)", 1, "", 0.5, List.of(key), List.of("NSG-0001-001"));
    }
}
