package com.eainde.nsgx.proposal;

import com.eainde.nsgx.model.CandidateDecision;

/**
 * Per-key decision before clustering. {@link CandidateDecision#ADD_NEW} here is
 * provisional: the document-count threshold is applied per cluster.
 */
record Verdict(CandidateDecision decision, String target, String reason) {

    static Verdict provisionalNew() {
        return new Verdict(CandidateDecision.ADD_NEW, null, null);
    }

    boolean isProvisionalNew() {
        return decision == CandidateDecision.ADD_NEW;
    }
}
