package com.eainde.nsgx.report;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.eainde.nsgx.report.ReportFixtures.added;
import static com.eainde.nsgx.report.ReportFixtures.ignored;
import static com.eainde.nsgx.report.ReportFixtures.mapped;
import static org.assertj.core.api.Assertions.assertThat;

class ReviewCsvExporterTest {

    private final ReviewCsvExporter exporter = new ReviewCsvExporter();

    private static List<Map<String, String>> parse(String csv) throws Exception {
        CsvMapper mapper = new CsvMapper();
        try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(csv)) {
            return rows.readAll();
        }
    }

    @Test
    @DisplayName("should write the header in column order")
    void header() {
        String csv = exporter.export(List.of());

        assertThat(csv.lines().findFirst()).contains(
                "category,candidate,decision,target_or_key,reason,doc_count,example_quote,confidence_avg");
    }

    @Test
    @DisplayName("should write one row per decision")
    void rows() throws Exception {
        String csv = exporter.export(List.of(
                added("activities", "geocaching", "Geocaching", 6, 0.8125),
                mapped("activities", "Klettern", "klettern"),
                ignored("zone_terms", "kernzone_nacht")));

        List<Map<String, String>> rows = parse(csv);

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0))
                .containsEntry("category", "activities")
                .containsEntry("candidate", "Geocaching")
                .containsEntry("decision", "ADD_NEW")
                .containsEntry("target_or_key", "geocaching")
                .containsEntry("doc_count", "6")
                .containsEntry("example_quote", "Geocaching ist verboten")
                .containsEntry("confidence_avg", "0.813");
        assertThat(rows).extracting(r -> r.get("decision"))
                .containsExactly("ADD_NEW", "MAP_TO_EXISTING", "IGNORE");
    }

    @Test
    @DisplayName("should quote values containing separators")
    void quoting() throws Exception {
        String csv = exporter.export(List.of(added("activities", "k", "Baden, Schwimmen", 5, 0.7)));

        assertThat(parse(csv).get(0)).containsEntry("candidate", "Baden, Schwimmen");
    }
}
