package com.eainde.nsgx.pipeline;

import com.eainde.nsgx.model.DocumentResult;
import com.eainde.nsgx.orchestration.BatchResult;
import com.eainde.nsgx.proposal.ProposalReport;
import com.eainde.nsgx.report.MergeSummary;
import com.eainde.nsgx.report.ProposeSummary;
import com.eainde.nsgx.report.RunSummary;

import java.util.List;

/**
 * Everything one end-to-end run produced.
 */
public record PipelineReport(
        BatchResult batch,
        List<DocumentResult> documents,
        ProposalReport proposals,
        RunSummary runSummary,
        MergeSummary mergeSummary,
        ProposeSummary proposeSummary
) {

    public PipelineReport {
        documents = List.copyOf(documents);
    }
}
