package com.eainde.nsgx.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts of one extraction run, written as {@code run_summary.json}.
 */
public record RunSummary(
        @JsonProperty("documents")            int documents,
        @JsonProperty("documents_failed")     int documentsFailed,
        @JsonProperty("units")                int units,
        @JsonProperty("units_succeeded")      int unitsSucceeded,
        @JsonProperty("units_failed")         int unitsFailed,
        @JsonProperty("units_skipped")        int unitsSkipped,
        @JsonProperty("cache_hits")           int cacheHits,
        @JsonProperty("live_calls")           int liveCalls,
        @JsonProperty("escalations")          int escalations,
        @JsonProperty("escalation_failures")  int escalationFailures,
        @JsonProperty("dropped_entries")      int droppedEntries,
        @JsonProperty("provider_mode")        String providerMode
) {}
