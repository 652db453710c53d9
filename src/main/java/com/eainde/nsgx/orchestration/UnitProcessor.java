package com.eainde.nsgx.orchestration;

import com.eainde.nsgx.cache.ResultCache;
import com.eainde.nsgx.chunk.TextUnit;
import com.eainde.nsgx.client.ExtractionClient;
import com.eainde.nsgx.client.ModelProfile;
import com.eainde.nsgx.exception.ResultStorageException;
import com.eainde.nsgx.model.ExtractionOutcome;
import com.eainde.nsgx.model.FailureKind;
import com.eainde.nsgx.model.StructuredResult;
import com.eainde.nsgx.model.UnitResult;
import lombok.extern.log4j.Log4j2;

import java.util.Optional;

/**
 * Takes one unit end-to-end: cache lookup, extraction, caching, escalation.
 *
 * <h3>Adaptive mode:</h3>
 * <pre>
 * cheap  = cache(fast) ?: extract(fast) → cache(fast)
 * if escalation policy fires on cheap:
 *     thorough = cache(thorough) ?: extract(thorough) → cache(thorough)
 *     final = thorough   (cheap is kept only if the thorough call fails)
 * </pre>
 *
 * <p>The policy is applied to cheap results from the cache as well, so a rerun over
 * a warm cache reproduces the same final results without any service call.</p>
 */
@Log4j2
public class UnitProcessor {

    private final ExtractionClient client;
    private final ResultCache cache;
    private final String instructions;
    private final ModelProfile fastModel;
    private final ModelProfile thoroughModel;
    private final ProviderMode mode;
    private final EscalationPolicy escalationPolicy;

    public UnitProcessor(ExtractionClient client,
                         ResultCache cache,
                         String instructions,
                         ModelProfile fastModel,
                         ModelProfile thoroughModel,
                         ProviderMode mode,
                         EscalationPolicy escalationPolicy) {
        this.client = client;
        this.cache = cache;
        this.instructions = instructions;
        this.fastModel = fastModel;
        this.thoroughModel = thoroughModel;
        this.mode = mode;
        this.escalationPolicy = escalationPolicy;
    }

    public ProviderMode getMode() {
        return mode;
    }

    UnitOutcome process(TextUnit unit) {
        Tally tally = new Tally();
        try {
            return switch (mode) {
                case FAST -> single(unit, fastModel, tally);
                case THOROUGH -> single(unit, thoroughModel, tally);
                case ADAPTIVE -> adaptive(unit, tally);
            };
        } catch (ResultStorageException e) {
            log.error("Cache read failed for {}/{}: {}", unit.documentId(), unit.unitId(), e.getMessage());
            return tally.failed(new UnitFailure(unit.documentId(), unit.unitId(), FailureKind.STORAGE, e.getMessage()));
        }
    }

    // ── Modes ───────────────────────────────────────────────────────────

    private UnitOutcome single(TextUnit unit, ModelProfile model, Tally tally) {
        Resolution resolution = resolve(unit, model, tally);
        if (resolution.failure != null) {
            return tally.failed(toFailure(unit, resolution.failure));
        }
        return tally.succeeded(UnitResult.of(unit, model.modelId(), resolution.result), false, false);
    }

    private UnitOutcome adaptive(TextUnit unit, Tally tally) {
        Resolution cheap = resolve(unit, fastModel, tally);
        if (cheap.failure != null) {
            return tally.failed(toFailure(unit, cheap.failure));
        }
        if (!escalationPolicy.shouldEscalate(cheap.result)) {
            return tally.succeeded(UnitResult.of(unit, fastModel.modelId(), cheap.result), false, false);
        }

        log.debug("Escalating {}/{} to {}", unit.documentId(), unit.unitId(), thoroughModel.modelId());
        Resolution thorough = resolve(unit, thoroughModel, tally);
        if (thorough.failure != null) {
            log.warn("Escalation of {}/{} failed ({}: {}); keeping {} result",
                    unit.documentId(), unit.unitId(), thorough.failure.kind(), thorough.failure.message(),
                    fastModel.modelId());
            return tally.succeeded(UnitResult.of(unit, fastModel.modelId(), cheap.result), false, true);
        }
        return tally.succeeded(UnitResult.of(unit, thoroughModel.modelId(), thorough.result), true, false);
    }

    // ── Cache-first resolution ──────────────────────────────────────────

    private Resolution resolve(TextUnit unit, ModelProfile model, Tally tally) {
        Optional<StructuredResult> cached = cache.get(unit.documentId(), unit.text(), model.modelId());
        if (cached.isPresent()) {
            tally.cacheHits++;
            log.debug("Cache hit {}/{} ({})", unit.documentId(), unit.unitId(), model.modelId());
            return new Resolution(cached.get(), null);
        }

        tally.liveCalls++;
        ExtractionOutcome outcome = client.extract(unit.text(), instructions, model);
        if (outcome instanceof ExtractionOutcome.Failure failure) {
            return new Resolution(null, failure);
        }
        ExtractionOutcome.Success success = (ExtractionOutcome.Success) outcome;
        tally.droppedEntries += success.dropped().size();
        try {
            cache.put(unit.documentId(), unit.text(), model.modelId(), success.result());
        } catch (ResultStorageException e) {
            log.error("Cache write failed for {}/{}: {}", unit.documentId(), unit.unitId(), e.getMessage());
            if (tally.storageError == null) {
                tally.storageError = e;
            }
        }
        return new Resolution(success.result(), null);
    }

    private static UnitFailure toFailure(TextUnit unit, ExtractionOutcome.Failure failure) {
        log.error("Unit {}/{} failed: {} {}", unit.documentId(), unit.unitId(), failure.kind(), failure.message());
        return new UnitFailure(unit.documentId(), unit.unitId(), failure.kind(), failure.message());
    }

    private record Resolution(StructuredResult result, ExtractionOutcome.Failure failure) {}

    /** Per-unit counters; confined to the worker processing the unit. */
    private static final class Tally {
        int cacheHits;
        int liveCalls;
        int droppedEntries;
        ResultStorageException storageError;

        UnitOutcome succeeded(UnitResult result, boolean escalated, boolean escalationFailed) {
            return new UnitOutcome(result, null, false, cacheHits, liveCalls,
                    escalated, escalationFailed, droppedEntries, storageError);
        }

        UnitOutcome failed(UnitFailure failure) {
            return new UnitOutcome(null, failure, false, cacheHits, liveCalls,
                    false, false, droppedEntries, storageError);
        }
    }
}
