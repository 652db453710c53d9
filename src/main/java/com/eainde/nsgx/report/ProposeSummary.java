package com.eainde.nsgx.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts of the proposal stage, written as {@code propose_summary.json}.
 */
public record ProposeSummary(
        @JsonProperty("documents")        int documents,
        @JsonProperty("observations")     int observations,
        @JsonProperty("min_doc_count")    int minDocCount,
        @JsonProperty("add_new")          int addNew,
        @JsonProperty("map_to_existing")  int mapToExisting,
        @JsonProperty("ignore")           int ignore
) {}
