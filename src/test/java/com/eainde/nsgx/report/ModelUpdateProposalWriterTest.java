package com.eainde.nsgx.report;

import com.eainde.nsgx.proposal.ProposalReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.eainde.nsgx.report.ReportFixtures.CLOCK;
import static com.eainde.nsgx.report.ReportFixtures.added;
import static org.assertj.core.api.Assertions.assertThat;

class ModelUpdateProposalWriterTest {

    private final ModelUpdateProposalWriter writer = new ModelUpdateProposalWriter(CLOCK);

    @Test
    @DisplayName("should summarize the run and flag confident proposals")
    void summary() {
        var confident = added("activities", "geocaching", "Geocaching", 6, 0.8);
        var unsure = added("activities", "kitesurfen", "Kitesurfen", 5, 0.6);
        ProposalReport report = new ProposalReport(List.of(confident, unsure), List.of(confident, unsure), 40, 12, 5);

        String md = writer.render(report);

        assertThat(md).contains("Generated on: 2024-05-01 10:15:30")
                .contains("adding 2 new enum values to the NSG data model, based on 40 candidate observations in 12 regulation documents")
                .contains("**High Priority**: 1 candidates")
                .contains("Only terms found in at least 5 documents proposed");
    }

    @Test
    @DisplayName("should omit the priority note when no proposal is confident")
    void noPriority() {
        ProposalReport report = new ProposalReport(List.of(), List.of(), 0, 3, 5);

        assertThat(writer.render(report)).doesNotContain("High Priority").contains("adding 0 new enum values");
    }
}
