package com.eainde.nsgx.orchestration;

import com.eainde.nsgx.model.Candidate;
import com.eainde.nsgx.model.CandidateDecision;
import com.eainde.nsgx.model.StructuredResult;

/**
 * Decides whether a cheap-model result is too uncertain to keep: any candidate the
 * model marked {@code UNSURE}, or any candidate below the confidence threshold.
 */
public class EscalationPolicy {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.65;

    private final double confidenceThreshold;

    public EscalationPolicy(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public boolean shouldEscalate(StructuredResult result) {
        for (Candidate candidate : result.allCandidates()) {
            if (candidate.decision() == CandidateDecision.UNSURE
                    || candidate.confidence() < confidenceThreshold) {
                return true;
            }
        }
        return false;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }
}
