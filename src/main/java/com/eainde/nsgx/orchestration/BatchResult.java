package com.eainde.nsgx.orchestration;

import com.eainde.nsgx.model.UnitResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Best-effort coverage of one orchestrator run.
 *
 * @param results            successful unit results, ordered by document then unit id
 * @param failures           failed units
 * @param skipped            units never started because the batch was aborted
 * @param cacheHits          cache lookups answered from the store
 * @param liveCalls          requests sent to the service
 * @param escalations        units whose final result came from the thorough model
 * @param escalationFailures escalations whose thorough call failed (cheap result kept)
 * @param droppedEntries     entries removed by response validation
 */
public record BatchResult(
        List<UnitResult> results,
        List<UnitFailure> failures,
        int skipped,
        int cacheHits,
        int liveCalls,
        int escalations,
        int escalationFailures,
        int droppedEntries
) {

    public BatchResult {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public int succeeded() {
        return results.size();
    }

    public int failed() {
        return failures.size();
    }

    public int total() {
        return succeeded() + failed() + skipped;
    }

    /**
     * @return successful results grouped by document id, documents sorted
     */
    public Map<String, List<UnitResult>> resultsByDocument() {
        Map<String, List<UnitResult>> byDocument = new TreeMap<>();
        for (UnitResult result : results) {
            byDocument.computeIfAbsent(result.documentId(), k -> new ArrayList<>()).add(result);
        }
        return byDocument;
    }
}
