package com.eainde.nsgx.report;

import com.eainde.nsgx.model.CandidateAggregate;
import com.eainde.nsgx.model.CandidateDecision;
import com.eainde.nsgx.proposal.ProposalReport;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Human-readable summary of proposed catalog additions.
 */
public class ChangelogWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int QUOTE_PREVIEW = 100;

    private final Clock clock;

    public ChangelogWriter(Clock clock) {
        this.clock = clock;
    }

    public String render(ProposalReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# NSG Data Model Changes\n\n");
        md.append("Generated on: ").append(LocalDateTime.now(clock).format(TIMESTAMP)).append("\n\n");

        List<CandidateAggregate> additions = report.aggregates();
        if (additions.isEmpty()) {
            md.append("## No new enum values added\n\n");
            md.append("All candidates were either mapped to existing values or ignored.\n\n");
        } else {
            md.append("## New Enum Values (").append(additions.size()).append(" additions)\n\n");
            Map<String, List<CandidateAggregate>> byCategory = additions.stream()
                    .collect(Collectors.groupingBy(CandidateAggregate::category, TreeMap::new, Collectors.toList()));
            byCategory.forEach((category, list) -> {
                md.append("### ").append(title(category)).append("\n\n");
                list.stream()
                        .sorted(Comparator.comparing(CandidateAggregate::targetOrKey))
                        .forEach(a -> {
                            md.append("**").append(a.targetOrKey()).append("**\n");
                            md.append("- Original term: ").append(a.representativeText()).append('\n');
                            md.append("- Found in ").append(a.supportingDocCount()).append(" documents\n");
                            md.append("- Example: \"").append(preview(a.exampleQuote())).append("\"\n");
                            md.append(String.format(Locale.ROOT, "- Mean confidence: %.2f\n", a.meanConfidence()));
                            md.append('\n');
                        });
            });
        }

        Map<CandidateDecision, Integer> counts = report.countByDecision();
        md.append("## Summary Statistics\n\n");
        md.append("- Total candidate groups analyzed: ").append(report.reviewRows().size()).append('\n');
        md.append("- New enum values added: ").append(counts.getOrDefault(CandidateDecision.ADD_NEW, 0)).append('\n');
        md.append("- Mapped to existing values: ").append(counts.getOrDefault(CandidateDecision.MAP_TO_EXISTING, 0)).append('\n');
        md.append("- Ignored (low frequency/quality): ").append(counts.getOrDefault(CandidateDecision.IGNORE, 0)).append('\n');
        return md.toString();
    }

    private static String title(String category) {
        return Arrays.stream(category.split("_"))
                .filter(w -> !w.isEmpty())
                .map(w -> Character.toUpperCase(w.charAt(0)) + w.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String preview(String quote) {
        return quote.length() <= QUOTE_PREVIEW ? quote : quote.substring(0, QUOTE_PREVIEW) + "...";
    }
}
