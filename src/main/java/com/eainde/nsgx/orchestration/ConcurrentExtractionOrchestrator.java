package com.eainde.nsgx.orchestration;

import com.eainde.nsgx.chunk.TextUnit;
import com.eainde.nsgx.exception.ResultStorageException;
import com.eainde.nsgx.model.FailureKind;
import com.eainde.nsgx.model.UnitResult;
import com.eainde.nsgx.thread.MdcAwareWorkerPool;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a batch of units through a {@link UnitProcessor} on exactly {@code concurrency}
 * workers.
 *
 * <h3>Guarantees:</h3>
 * <ul>
 *   <li>A failed unit is recorded and never aborts the batch.</li>
 *   <li>Completion order is arbitrary; the returned results are sorted by document
 *       and unit id.</li>
 *   <li>{@link #abort()} stops scheduling: units not yet started are counted as
 *       skipped, in-flight units finish and may still populate the cache. An abort
 *       requested before {@link #process(List)} starts applies to that next batch;
 *       the flag is cleared when a batch ends.</li>
 *   <li>Cache write failures do not lose results: the batch completes and then a
 *       {@link ResultStorageException} carrying the full {@link BatchResult} is thrown.</li>
 * </ul>
 */
@Log4j2
public class ConcurrentExtractionOrchestrator {

    private static final Comparator<UnitResult> RESULT_ORDER = Comparator
            .comparing(UnitResult::documentId)
            .thenComparing(UnitResult::unitId);

    private final UnitProcessor processor;
    private final int concurrency;
    private final AtomicBoolean aborted = new AtomicBoolean();

    public ConcurrentExtractionOrchestrator(UnitProcessor processor, int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0, was " + concurrency);
        }
        this.processor = processor;
        this.concurrency = concurrency;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Processes all units and returns best-effort coverage.
     *
     * @throws ResultStorageException after the batch completes, if any cache write failed
     */
    public BatchResult process(List<TextUnit> units) {
        try {
            return runBatch(units);
        } finally {
            aborted.set(false);
        }
    }

    private BatchResult runBatch(List<TextUnit> units) {
        log.info("Processing {} units with {} workers in {} mode", units.size(), concurrency, processor.getMode());

        List<UnitOutcome> outcomes = new ArrayList<>(units.size());
        try (MdcAwareWorkerPool pool = new MdcAwareWorkerPool(concurrency, "nsgx-worker")) {
            CompletionService<UnitOutcome> completion = new ExecutorCompletionService<>(pool);
            List<TextUnit> submitted = new ArrayList<>(units.size());
            for (TextUnit unit : units) {
                completion.submit(() -> runUnit(unit));
                submitted.add(unit);
            }

            int progressStep = Math.max(1, units.size() / 10);
            for (int i = 0; i < submitted.size(); i++) {
                Future<UnitOutcome> future;
                try {
                    future = completion.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    aborted.set(true);
                    log.warn("Interrupted after {} of {} units; no further units will start", i, units.size());
                    break;
                }
                outcomes.add(collect(future));
                if ((i + 1) % progressStep == 0) {
                    log.info("Progress: {}/{} units", i + 1, units.size());
                }
            }
        }

        BatchResult batch = summarize(outcomes, units.size());
        log.info("Batch complete: {} succeeded, {} failed, {} skipped, {} cache hits, {} live calls, {} escalations",
                batch.succeeded(), batch.failed(), batch.skipped(), batch.cacheHits(), batch.liveCalls(),
                batch.escalations());

        ResultStorageException storageError = outcomes.stream()
                .map(UnitOutcome::storageError)
                .filter(e -> e != null)
                .findFirst()
                .orElse(null);
        if (storageError != null) {
            throw new ResultStorageException("Result cache write failed during batch", storageError, batch);
        }
        return batch;
    }

    /**
     * Stops scheduling new units for the running batch.
     */
    public void abort() {
        if (!aborted.getAndSet(true)) {
            log.warn("Batch aborted; remaining units will be skipped");
        }
    }

    public ProviderMode getMode() {
        return processor.getMode();
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private UnitOutcome runUnit(TextUnit unit) {
        if (aborted.get()) {
            return UnitOutcome.notStarted();
        }
        MDC.put("docId", unit.documentId());
        MDC.put("unitId", unit.unitId());
        try {
            return processor.process(unit);
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}/{}", unit.documentId(), unit.unitId(), e);
            return new UnitOutcome(null,
                    new UnitFailure(unit.documentId(), unit.unitId(), FailureKind.UNEXPECTED, String.valueOf(e)),
                    false, 0, 0, false, false, 0, null);
        } finally {
            MDC.remove("docId");
            MDC.remove("unitId");
        }
    }

    private static UnitOutcome collect(Future<UnitOutcome> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unit task failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UnitOutcome.notStarted();
        }
    }

    private static BatchResult summarize(List<UnitOutcome> outcomes, int totalUnits) {
        List<UnitResult> results = new ArrayList<>();
        List<UnitFailure> failures = new ArrayList<>();
        int skipped = totalUnits - outcomes.size();
        int cacheHits = 0;
        int liveCalls = 0;
        int escalations = 0;
        int escalationFailures = 0;
        int dropped = 0;
        for (UnitOutcome outcome : outcomes) {
            if (outcome.skipped()) {
                skipped++;
            } else if (outcome.result() != null) {
                results.add(outcome.result());
            } else if (outcome.failure() != null) {
                failures.add(outcome.failure());
            }
            cacheHits += outcome.cacheHits();
            liveCalls += outcome.liveCalls();
            escalations += outcome.escalated() ? 1 : 0;
            escalationFailures += outcome.escalationFailed() ? 1 : 0;
            dropped += outcome.droppedEntries();
        }
        results.sort(RESULT_ORDER);
        return new BatchResult(results, failures, skipped, cacheHits, liveCalls,
                escalations, escalationFailures, dropped);
    }
}
