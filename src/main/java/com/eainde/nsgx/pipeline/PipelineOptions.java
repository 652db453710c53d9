package com.eainde.nsgx.pipeline;

import com.eainde.nsgx.client.ModelProfile;

/**
 * Run-level switches of {@link EnumDiffPipeline}.
 *
 * @param ruleFilterEnabled keep only rule-bearing units
 * @param connectivityModel model probed before the batch; null skips the check
 * @param minDocCount       document threshold for new vocabulary
 * @param overwrite         replace existing document results and derived artifacts
 */
public record PipelineOptions(
        boolean ruleFilterEnabled,
        ModelProfile connectivityModel,
        int minDocCount,
        boolean overwrite
) {

    public PipelineOptions {
        if (minDocCount < 1) {
            throw new IllegalArgumentException("minDocCount must be >= 1, was " + minDocCount);
        }
    }
}
