package com.eainde.nsgx.report;

import com.eainde.nsgx.model.CandidateAggregate;
import com.eainde.nsgx.proposal.ProposalReport;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Markdown proposal for the data-model owners summarizing what the run suggests and
 * how to review it.
 */
public class ModelUpdateProposalWriter {

    static final double HIGH_PRIORITY_CONFIDENCE = 0.7;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public ModelUpdateProposalWriter(Clock clock) {
        this.clock = clock;
    }

    public String render(ProposalReport report) {
        long highPriority = report.aggregates().stream()
                .mapToDouble(CandidateAggregate::meanConfidence)
                .filter(c -> c > HIGH_PRIORITY_CONFIDENCE)
                .count();

        StringBuilder md = new StringBuilder();
        md.append("# NSG Data Model Update Proposal\n\n");
        md.append("Generated on: ").append(LocalDateTime.now(clock).format(TIMESTAMP)).append("\n\n");

        md.append("## Executive Summary\n\n");
        md.append("This proposal suggests adding ").append(report.aggregates().size())
                .append(" new enum values to the NSG data model, based on ")
                .append(report.observations()).append(" candidate observations in ")
                .append(report.documents()).append(" regulation documents.\n\n");
        if (highPriority > 0) {
            md.append("**High Priority**: ").append(highPriority)
                    .append(" candidates have mean confidence > ").append(HIGH_PRIORITY_CONFIDENCE)
                    .append(" and should be reviewed first.\n\n");
        }

        md.append("## Method\n\n");
        md.append("1. Regulation text split into section-aligned units\n");
        md.append("2. Rules and unknown terms extracted per unit, low-confidence units re-checked by a stronger model\n");
        md.append("3. Qualified variants of existing activities mapped to conditions, not new values\n");
        md.append("4. Similar terms clustered across documents\n");
        md.append("5. Only terms found in at least ").append(report.minDocCount()).append(" documents proposed\n\n");

        md.append("## Next Steps\n\n");
        md.append("1. Review `review/candidates_review.csv`\n");
        md.append("2. Validate high-confidence candidates first, using the example quotes\n");
        md.append("3. Apply `dbml_patches/enum_additions.dbml` to the data model\n");
        md.append("4. Re-run extraction on affected documents\n");
        return md.toString();
    }
}
