package com.eainde.nsgx.report;

import com.eainde.nsgx.model.CandidateAggregate;
import com.eainde.nsgx.model.CandidateDecision;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * DBML enum extensions for the ADD_NEW aggregates, one {@code Enum} block per
 * target enum.
 */
public class DbmlPatchWriter {

    static final Map<String, String> CATEGORY_ENUMS = Map.of(
            "activities", "aktivitaet_enum",
            "zone_terms", "zone_typ_enum",
            "place_terms", "ort_enum");

    private final Clock clock;

    public DbmlPatchWriter(Clock clock) {
        this.clock = clock;
    }

    public String render(List<CandidateAggregate> aggregates) {
        Map<String, TreeSet<String>> additions = new TreeMap<>();
        for (CandidateAggregate aggregate : aggregates) {
            String enumName = CATEGORY_ENUMS.get(aggregate.category());
            if (enumName != null && aggregate.decision() == CandidateDecision.ADD_NEW) {
                additions.computeIfAbsent(enumName, k -> new TreeSet<>()).add(aggregate.targetOrKey());
            }
        }

        StringBuilder dbml = new StringBuilder();
        dbml.append("// Generated DBML enum additions\n");
        dbml.append("// Generated on: ").append(OffsetDateTime.now(clock)).append("\n\n");
        if (additions.isEmpty()) {
            dbml.append("// No new enum values to add\n");
            return dbml.toString();
        }
        additions.forEach((enumName, values) -> {
            dbml.append("// Add to ").append(enumName).append(":\n");
            dbml.append("Enum ").append(enumName).append(" {\n");
            values.forEach(v -> dbml.append("  ").append(v).append('\n'));
            dbml.append("}\n\n");
        });
        return dbml.toString();
    }
}
