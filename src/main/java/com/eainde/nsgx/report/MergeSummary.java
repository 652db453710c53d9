package com.eainde.nsgx.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts of the per-document merge, written as {@code merge_summary.json}.
 */
public record MergeSummary(
        @JsonProperty("documents_merged")   int documentsMerged,
        @JsonProperty("documents_written")  int documentsWritten,
        @JsonProperty("rules_before_merge") int rulesBeforeMerge,
        @JsonProperty("rules_after_merge")  int rulesAfterMerge,
        @JsonProperty("candidates")         int candidates
) {}
