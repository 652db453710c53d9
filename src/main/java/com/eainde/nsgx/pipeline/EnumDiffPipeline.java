package com.eainde.nsgx.pipeline;

import com.eainde.nsgx.chunk.DocumentSegmenter;
import com.eainde.nsgx.chunk.RuleBearingUnitFilter;
import com.eainde.nsgx.chunk.TextUnit;
import com.eainde.nsgx.client.ExtractionClient;
import com.eainde.nsgx.exception.NsgxException;
import com.eainde.nsgx.exception.ResultStorageException;
import com.eainde.nsgx.merge.DocumentMergeEngine;
import com.eainde.nsgx.model.CandidateDecision;
import com.eainde.nsgx.model.DocumentResult;
import com.eainde.nsgx.model.UnitResult;
import com.eainde.nsgx.orchestration.BatchResult;
import com.eainde.nsgx.orchestration.ConcurrentExtractionOrchestrator;
import com.eainde.nsgx.orchestration.UnitFailure;
import com.eainde.nsgx.proposal.ProposalEngine;
import com.eainde.nsgx.proposal.ProposalReport;
import com.eainde.nsgx.report.ChangelogWriter;
import com.eainde.nsgx.report.DbmlPatchWriter;
import com.eainde.nsgx.report.MergeSummary;
import com.eainde.nsgx.report.ModelUpdateProposalWriter;
import com.eainde.nsgx.report.OutputLayout;
import com.eainde.nsgx.report.ProposeSummary;
import com.eainde.nsgx.report.ResultWriter;
import com.eainde.nsgx.report.ReviewCsvExporter;
import com.eainde.nsgx.report.RunSummary;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * End-to-end run over a directory of regulation texts.
 *
 * <h3>Stages:</h3>
 * <pre>
 * LOAD:     *.txt → SourceDocument
 * SEGMENT:  DocumentSegmenter (+ optional RuleBearingUnitFilter) → TextUnit
 * CHECK:    one connectivity probe; failure aborts before any unit is scheduled
 * EXTRACT:  ConcurrentExtractionOrchestrator → unit_results/
 * MERGE:    DocumentMergeEngine per document → docs/
 * PROPOSE:  ProposalEngine over all merged documents → proposals.jsonl
 * EXPORT:   review CSV, CHANGELOG.md, DBML patch, model update proposal, summaries
 * </pre>
 *
 * <p>A cache write failure during EXTRACT does not stop the run: every stage still
 * runs on the results produced, then the {@link ResultStorageException} is rethrown.</p>
 */
@Log4j2
public class EnumDiffPipeline {

    private final TextDocumentSource source;
    private final DocumentSegmenter segmenter;
    private final RuleBearingUnitFilter ruleFilter;
    private final ExtractionClient client;
    private final ConcurrentExtractionOrchestrator orchestrator;
    private final DocumentMergeEngine mergeEngine;
    private final ProposalEngine proposalEngine;
    private final ResultWriter writer;
    private final ReviewCsvExporter reviewCsvExporter;
    private final ChangelogWriter changelogWriter;
    private final DbmlPatchWriter dbmlPatchWriter;
    private final ModelUpdateProposalWriter modelUpdateProposalWriter;
    private final PipelineOptions options;

    public EnumDiffPipeline(TextDocumentSource source,
                            DocumentSegmenter segmenter,
                            RuleBearingUnitFilter ruleFilter,
                            ExtractionClient client,
                            ConcurrentExtractionOrchestrator orchestrator,
                            DocumentMergeEngine mergeEngine,
                            ProposalEngine proposalEngine,
                            ResultWriter writer,
                            ReviewCsvExporter reviewCsvExporter,
                            ChangelogWriter changelogWriter,
                            DbmlPatchWriter dbmlPatchWriter,
                            ModelUpdateProposalWriter modelUpdateProposalWriter,
                            PipelineOptions options) {
        this.source = source;
        this.segmenter = segmenter;
        this.ruleFilter = ruleFilter;
        this.client = client;
        this.orchestrator = orchestrator;
        this.mergeEngine = mergeEngine;
        this.proposalEngine = proposalEngine;
        this.writer = writer;
        this.reviewCsvExporter = reviewCsvExporter;
        this.changelogWriter = changelogWriter;
        this.dbmlPatchWriter = dbmlPatchWriter;
        this.modelUpdateProposalWriter = modelUpdateProposalWriter;
        this.options = options;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Runs every stage over the documents in {@code inputDir}.
     *
     * @throws ResultStorageException after all outputs are written, if a cache write failed
     */
    public PipelineReport run(Path inputDir) {
        MDC.put("runId", UUID.randomUUID().toString().substring(0, 8));
        try {
            return doRun(inputDir);
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * Re-runs PROPOSE and EXPORT over the document results already in the output
     * directory, without any service call.
     */
    public ProposalReport proposeFromOutput() {
        List<DocumentResult> documents = writer.readDocumentResults();
        log.info("Proposing from {} stored document results", documents.size());
        return proposeAndExport(documents);
    }

    // =========================================================================
    //  Stages
    // =========================================================================

    private PipelineReport doRun(Path inputDir) {
        // ── LOAD + SEGMENT ──────────────────────────────────────────────
        List<SourceDocument> documents = source.load(inputDir);
        List<TextUnit> units = segment(documents);

        // ── CHECK ───────────────────────────────────────────────────────
        if (options.connectivityModel() != null && !units.isEmpty()
                && !client.checkConnectivity(options.connectivityModel())) {
            throw new NsgxException("Connectivity check against "
                    + options.connectivityModel().modelId() + " failed; no unit was scheduled");
        }

        // ── EXTRACT ─────────────────────────────────────────────────────
        ResultStorageException storageFailure = null;
        BatchResult batch;
        try {
            batch = orchestrator.process(units);
        } catch (ResultStorageException e) {
            if (e.getPartialResult() == null) {
                throw e;
            }
            log.error("Result cache write failed; continuing with the results produced", e);
            storageFailure = e;
            batch = e.getPartialResult();
        }
        batch.results().forEach(writer::writeUnitResult);
        RunSummary runSummary = runSummary(documents, batch);
        writer.writeSummary("run", runSummary);

        // ── MERGE ───────────────────────────────────────────────────────
        List<DocumentResult> merged = new ArrayList<>();
        int written = 0;
        int rulesBefore = 0;
        for (Map.Entry<String, List<UnitResult>> entry : batch.resultsByDocument().entrySet()) {
            DocumentResult document = mergeEngine.merge(entry.getKey(), entry.getValue());
            rulesBefore += entry.getValue().stream().mapToInt(r -> r.facts().size()).sum();
            merged.add(document);
            if (writer.writeDocumentResult(document, options.overwrite())) {
                written++;
            }
        }
        MergeSummary mergeSummary = new MergeSummary(merged.size(), written, rulesBefore,
                merged.stream().mapToInt(d -> d.factsMerged().size()).sum(),
                merged.stream().mapToInt(DocumentResult::candidateCount).sum());
        writer.writeSummary("merge", mergeSummary);
        log.info("Merged {} documents: {} rules → {}, {} candidates",
                mergeSummary.documentsMerged(), rulesBefore, mergeSummary.rulesAfterMerge(),
                mergeSummary.candidates());

        // ── PROPOSE + EXPORT ────────────────────────────────────────────
        ProposalReport proposals = proposeAndExport(merged);

        if (storageFailure != null) {
            throw storageFailure;
        }
        return new PipelineReport(batch, merged, proposals, runSummary, mergeSummary, proposeSummary(proposals));
    }

    private List<TextUnit> segment(List<SourceDocument> documents) {
        List<TextUnit> units = new ArrayList<>();
        int segmented = 0;
        for (SourceDocument document : documents) {
            List<TextUnit> documentUnits = segmenter.segment(document.documentId(), document.text());
            segmented += documentUnits.size();
            units.addAll(options.ruleFilterEnabled() ? ruleFilter.filter(documentUnits) : documentUnits);
        }
        if (options.ruleFilterEnabled()) {
            log.info("Segmented {} documents into {} units, {} kept by rule filter",
                    documents.size(), segmented, units.size());
        } else {
            log.info("Segmented {} documents into {} units", documents.size(), units.size());
        }
        return units;
    }

    private ProposalReport proposeAndExport(List<DocumentResult> documents) {
        ProposalReport report = proposalEngine.propose(documents, options.minDocCount());
        OutputLayout layout = writer.getLayout();
        boolean overwrite = options.overwrite();

        writer.writeAggregates(report.aggregates());
        writer.writeText(layout.reviewCsv(), reviewCsvExporter.export(report.reviewRows()), overwrite);
        writer.writeText(layout.changelog(), changelogWriter.render(report), overwrite);
        writer.writeText(layout.dbmlPatch(), dbmlPatchWriter.render(report.aggregates()), overwrite);
        writer.writeText(layout.modelUpdateProposal(), modelUpdateProposalWriter.render(report), overwrite);
        writer.writeSummary("propose", proposeSummary(report));

        log.info("Proposed {} new values from {} documents ({} review rows)",
                report.aggregates().size(), report.documents(), report.reviewRows().size());
        return report;
    }

    // =========================================================================
    //  Summaries
    // =========================================================================

    /**
     * A document counts as failed when it had units and none of them succeeded.
     */
    private RunSummary runSummary(List<SourceDocument> documents, BatchResult batch) {
        Set<String> succeeded = batch.resultsByDocument().keySet();
        Set<String> failed = new TreeSet<>();
        for (UnitFailure failure : batch.failures()) {
            if (!succeeded.contains(failure.documentId())) {
                failed.add(failure.documentId());
            }
        }
        if (!failed.isEmpty()) {
            log.error("{} documents produced no result: {}", failed.size(), failed);
        }
        return new RunSummary(documents.size(), failed.size(), batch.total(), batch.succeeded(),
                batch.failed(), batch.skipped(), batch.cacheHits(), batch.liveCalls(), batch.escalations(),
                batch.escalationFailures(), batch.droppedEntries(), orchestrator.getMode().name());
    }

    private static ProposeSummary proposeSummary(ProposalReport report) {
        Map<CandidateDecision, Integer> counts = report.countByDecision();
        return new ProposeSummary(report.documents(), report.observations(), report.minDocCount(),
                counts.getOrDefault(CandidateDecision.ADD_NEW, 0),
                counts.getOrDefault(CandidateDecision.MAP_TO_EXISTING, 0),
                counts.getOrDefault(CandidateDecision.IGNORE, 0));
    }
}
