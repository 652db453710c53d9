package com.eainde.nsgx.orchestration;

import com.eainde.nsgx.exception.ResultStorageException;
import com.eainde.nsgx.model.UnitResult;

/**
 * What processing one unit produced, plus the bookkeeping the batch totals need.
 *
 * @param result             the final unit result, or null on failure or skip
 * @param failure            the failure, or null
 * @param skipped            true if the batch was aborted before the unit started
 * @param cacheHits          cache lookups answered from the store
 * @param liveCalls          requests sent to the service
 * @param escalated          true if the thorough model's answer became final
 * @param escalationFailed   true if escalation was attempted but the thorough call failed
 * @param droppedEntries     entries removed by response validation
 * @param storageError       cache write failure; the result is still kept
 */
record UnitOutcome(
        UnitResult result,
        UnitFailure failure,
        boolean skipped,
        int cacheHits,
        int liveCalls,
        boolean escalated,
        boolean escalationFailed,
        int droppedEntries,
        ResultStorageException storageError
) {

    static UnitOutcome notStarted() {
        return new UnitOutcome(null, null, true, 0, 0, false, false, 0, null);
    }
}
