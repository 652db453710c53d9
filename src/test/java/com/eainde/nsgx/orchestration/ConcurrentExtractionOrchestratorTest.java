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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.eainde.nsgx.orchestration.UnitProcessorTest.FAST;
import static com.eainde.nsgx.orchestration.UnitProcessorTest.INSTRUCTIONS;
import static com.eainde.nsgx.orchestration.UnitProcessorTest.THOROUGH;
import static com.eainde.nsgx.orchestration.UnitProcessorTest.withCandidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConcurrentExtractionOrchestratorTest {

    @Mock
    private ExtractionClient client;

    private final InMemoryResultCache cache = new InMemoryResultCache();

    private ConcurrentExtractionOrchestrator orchestrator(ProviderMode mode, int concurrency, ResultCache resultCache) {
        UnitProcessor processor = new UnitProcessor(client, resultCache, INSTRUCTIONS, FAST, THOROUGH, mode,
                new EscalationPolicy(0.65));
        return new ConcurrentExtractionOrchestrator(processor, concurrency);
    }

    private ConcurrentExtractionOrchestrator orchestrator(ProviderMode mode, int concurrency) {
        return orchestrator(mode, concurrency, cache);
    }

    private static List<TextUnit> units(int documents, int unitsPerDocument) {
        List<TextUnit> units = new ArrayList<>();
        for (int d = documents; d >= 1; d--) {
            for (int u = unitsPerDocument - 1; u >= 0; u--) {
                units.add(TextUnit.of("NSG-0000-00" + d, u, "Dokument " + d + " Abschnitt " + u + " verboten."));
            }
        }
        return units;
    }

    @Test
    @DisplayName("should process every unit and return results sorted by document and unit")
    void processesAll() {
        when(client.extract(anyString(), eq(INSTRUCTIONS), eq(FAST))).thenReturn(withCandidate("k", 0.9));
        List<TextUnit> units = units(3, 4);

        BatchResult batch = orchestrator(ProviderMode.ADAPTIVE, 4).process(units);

        assertThat(batch.succeeded()).isEqualTo(12);
        assertThat(batch.failed()).isZero();
        assertThat(batch.liveCalls()).isEqualTo(12);
        assertThat(batch.results()).extracting(UnitResult::documentId, UnitResult::unitId)
                .first().isEqualTo(tuple("NSG-0000-001", "chunk_000"));
        assertThat(batch.resultsByDocument()).containsOnlyKeys("NSG-0000-001", "NSG-0000-002", "NSG-0000-003");
    }

    @Test
    @DisplayName("should run exactly N units concurrently")
    void boundedConcurrency() throws Exception {
        int workers = 3;
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch allWorkersBusy = new CountDownLatch(workers);
        when(client.extract(anyString(), anyString(), any(ModelProfile.class))).thenAnswer(invocation -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            allWorkersBusy.countDown();
            allWorkersBusy.await(5, TimeUnit.SECONDS);
            Thread.sleep(10);
            inFlight.decrementAndGet();
            return withCandidate("k", 0.9);
        });

        BatchResult batch = orchestrator(ProviderMode.FAST, workers).process(units(2, 5));

        assertThat(batch.succeeded()).isEqualTo(10);
        assertThat(peak.get()).isEqualTo(workers);
    }

    @Test
    @DisplayName("should record failures without aborting the batch")
    void failuresDoNotAbort() {
        when(client.extract(anyString(), anyString(), any(ModelProfile.class))).thenAnswer(invocation -> {
            String text = invocation.getArgument(0);
            if (text.contains("Abschnitt 1 ")) {
                return ExtractionOutcome.failure(FailureKind.TIMEOUT, "Timed out after 60s", null);
            }
            if (text.contains("Abschnitt 2 ")) {
                throw new IllegalStateException("boom");
            }
            return withCandidate("k", 0.9);
        });

        BatchResult batch = orchestrator(ProviderMode.FAST, 2).process(units(2, 4));

        assertThat(batch.total()).isEqualTo(8);
        assertThat(batch.succeeded()).isEqualTo(4);
        assertThat(batch.failures()).extracting(UnitFailure::kind)
                .containsOnly(FailureKind.TIMEOUT, FailureKind.UNEXPECTED)
                .hasSize(4);
    }

    @Test
    @DisplayName("should be idempotent over a warm cache with zero service calls")
    void warmRerun() {
        when(client.extract(anyString(), eq(INSTRUCTIONS), eq(FAST))).thenReturn(withCandidate("cheap", 0.4));
        when(client.extract(anyString(), eq(INSTRUCTIONS), eq(THOROUGH))).thenReturn(withCandidate("thorough", 0.8));
        List<TextUnit> units = units(2, 3);
        BatchResult first = orchestrator(ProviderMode.ADAPTIVE, 3).process(units);

        ExtractionClient offline = mock(ExtractionClient.class);
        UnitProcessor processor = new UnitProcessor(offline, cache, INSTRUCTIONS, FAST, THOROUGH,
                ProviderMode.ADAPTIVE, new EscalationPolicy(0.65));
        BatchResult second = new ConcurrentExtractionOrchestrator(processor, 3).process(units);

        assertThat(first.escalations()).isEqualTo(6);
        assertThat(second.results()).isEqualTo(first.results());
        assertThat(second.liveCalls()).isZero();
        assertThat(second.cacheHits()).isEqualTo(12);
    }

    @Test
    @DisplayName("abort should skip units that have not started")
    void abort() {
        ConcurrentExtractionOrchestrator[] holder = new ConcurrentExtractionOrchestrator[1];
        when(client.extract(anyString(), anyString(), any(ModelProfile.class))).thenAnswer(invocation -> {
            holder[0].abort();
            return withCandidate("k", 0.9);
        });
        holder[0] = orchestrator(ProviderMode.FAST, 1);

        BatchResult batch = holder[0].process(units(1, 5));

        assertThat(batch.succeeded()).isEqualTo(1);
        assertThat(batch.skipped()).isEqualTo(4);
        assertThat(batch.total()).isEqualTo(5);
    }

    @Test
    @DisplayName("an abort requested before the batch starts should skip every unit and clear for the next batch")
    void abortBeforeStart() {
        ConcurrentExtractionOrchestrator orchestrator = orchestrator(ProviderMode.FAST, 2);
        orchestrator.abort();

        BatchResult aborted = orchestrator.process(units(1, 3));

        assertThat(aborted.succeeded()).isZero();
        assertThat(aborted.skipped()).isEqualTo(3);
        assertThat(aborted.liveCalls()).isZero();

        when(client.extract(anyString(), anyString(), any(ModelProfile.class))).thenReturn(withCandidate("k", 0.9));
        BatchResult next = orchestrator.process(units(1, 3));

        assertThat(next.succeeded()).isEqualTo(3);
        assertThat(next.skipped()).isZero();
    }

    @Test
    @DisplayName("should finish the batch and then throw with every produced result when a cache write fails")
    void storageFailure() {
        ResultCache failing = mock(ResultCache.class);
        when(failing.get(anyString(), anyString(), anyString())).thenReturn(Optional.empty());
        doAnswer(invocation -> {
            String text = invocation.getArgument(1);
            if (text.contains("Abschnitt 0 ")) {
                throw new ResultStorageException("disk full", null);
            }
            return null;
        }).when(failing).put(anyString(), anyString(), anyString(), any(StructuredResult.class));
        when(client.extract(anyString(), anyString(), any(ModelProfile.class))).thenReturn(withCandidate("k", 0.9));

        ConcurrentExtractionOrchestrator orchestrator = orchestrator(ProviderMode.FAST, 2, failing);

        assertThatThrownBy(() -> orchestrator.process(units(2, 3)))
                .isInstanceOf(ResultStorageException.class)
                .satisfies(e -> {
                    BatchResult partial = ((ResultStorageException) e).getPartialResult();
                    assertThat(partial).isNotNull();
                    assertThat(partial.succeeded()).isEqualTo(6);
                });
    }

    @Test
    @DisplayName("should carry the caller's MDC and set document and unit ids in workers")
    void mdcPropagation() {
        Map<String, String> seen = new ConcurrentHashMap<>();
        when(client.extract(anyString(), anyString(), any(ModelProfile.class))).thenAnswer(invocation -> {
            seen.put("runId", String.valueOf(MDC.get("runId")));
            seen.put("docId", String.valueOf(MDC.get("docId")));
            seen.put("unitId", String.valueOf(MDC.get("unitId")));
            return withCandidate("k", 0.9);
        });

        MDC.put("runId", "run-42");
        try {
            orchestrator(ProviderMode.FAST, 1).process(units(1, 1));
        } finally {
            MDC.remove("runId");
        }

        assertThat(seen).containsEntry("runId", "run-42")
                .containsEntry("docId", "NSG-0000-001")
                .containsEntry("unitId", "chunk_000");
    }
}
