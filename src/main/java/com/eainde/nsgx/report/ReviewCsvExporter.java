package com.eainde.nsgx.report;

import com.eainde.nsgx.model.CandidateAggregate;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tabular review export: one row per aggregate, every decision included.
 */
public class ReviewCsvExporter {

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(ReviewRow.class).withHeader();

    public String export(List<CandidateAggregate> rows) {
        if (rows.isEmpty()) {
            // the CSV generator only writes the header along with the first row
            List<String> columns = new ArrayList<>();
            schema.forEach(column -> columns.add(column.getName()));
            return String.join(",", columns) + "\n";
        }
        List<ReviewRow> csvRows = rows.stream().map(ReviewRow::of).toList();
        try {
            return csvMapper.writer(schema).writeValueAsString(csvRows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render review CSV", e);
        }
    }

    @JsonPropertyOrder({"category", "candidate", "decision", "target_or_key", "reason",
            "doc_count", "example_quote", "confidence_avg"})
    record ReviewRow(
            @JsonProperty("category")       String category,
            @JsonProperty("candidate")      String candidate,
            @JsonProperty("decision")       String decision,
            @JsonProperty("target_or_key")  String targetOrKey,
            @JsonProperty("reason")         String reason,
            @JsonProperty("doc_count")      int docCount,
            @JsonProperty("example_quote")  String exampleQuote,
            @JsonProperty("confidence_avg") String confidenceAvg
    ) {
        static ReviewRow of(CandidateAggregate aggregate) {
            return new ReviewRow(
                    aggregate.category(),
                    aggregate.representativeText(),
                    aggregate.decision().name(),
                    aggregate.targetOrKey(),
                    aggregate.reason(),
                    aggregate.supportingDocCount(),
                    aggregate.exampleQuote(),
                    String.format(Locale.ROOT, "%.3f", aggregate.meanConfidence()));
        }
    }
}
