package com.eainde.nsgx.proposal;

import com.eainde.nsgx.model.CandidateAggregate;
import com.eainde.nsgx.model.CandidateDecision;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a corpus-wide proposal run.
 *
 * @param aggregates   ADD_NEW clusters meeting the document threshold, sorted by
 *                     supporting documents then mean confidence (both descending)
 * @param reviewRows   every decision (ADD_NEW, MAP_TO_EXISTING, IGNORE) in the same order
 * @param observations candidate observations considered
 * @param documents    documents considered
 * @param minDocCount  threshold applied
 */
public record ProposalReport(
        List<CandidateAggregate> aggregates,
        List<CandidateAggregate> reviewRows,
        int observations,
        int documents,
        int minDocCount
) {

    public ProposalReport {
        aggregates = List.copyOf(aggregates);
        reviewRows = List.copyOf(reviewRows);
    }

    public Map<CandidateDecision, Integer> countByDecision() {
        Map<CandidateDecision, Integer> counts = new EnumMap<>(CandidateDecision.class);
        for (CandidateAggregate row : reviewRows) {
            counts.merge(row.decision(), 1, Integer::sum);
        }
        return counts;
    }
}
