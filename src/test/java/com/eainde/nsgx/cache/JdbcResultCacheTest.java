package com.eainde.nsgx.cache;

import com.eainde.nsgx.exception.ResultStorageException;
import com.eainde.nsgx.model.Candidate;
import com.eainde.nsgx.model.Condition;
import com.eainde.nsgx.model.Fact;
import com.eainde.nsgx.model.StructuredResult;
import com.eainde.nsgx.model.Zone;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcResultCacheTest {

    private static final String TEXT = "§ 4 Verbote\nEs ist verboten, Drohnen steigen zu lassen.";

    private JdbcTemplate jdbcTemplate;
    private JdbcResultCache cache;

    @BeforeEach
    void setUp() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:cache_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        jdbcTemplate = new JdbcTemplate(dataSource);
        cache = new JdbcResultCache(jdbcTemplate, new DataSourceTransactionManager(dataSource), new ObjectMapper());
        cache.initializeSchema();
    }

    private static StructuredResult sampleResult() {
        Fact fact = new Fact("drohnen_flugmodelle", "gesamte_flaeche_des_gebietes", "verboten",
                new Zone("ruhezone", null),
                List.of(Condition.range("datumspanne", "01.03.", "15.07.")),
                List.of("§ 4 Nr. 7"), 0.9, "Drohnen = Flugmodelle");
        Candidate candidate = Candidate.of("drohnen_steigen_lassen", "Drohnen steigen lassen", "Drohnen steigen lassen", 0.7);
        return new StructuredResult(List.of(fact), Map.of("activities", List.of(candidate)));
    }

    @Test
    @DisplayName("should return empty on a miss")
    void miss() {
        assertThat(cache.get("NSG-0001-001", TEXT, "deepseek-chat")).isEmpty();
    }

    @Test
    @DisplayName("should return an equal result after put")
    void roundTrip() {
        StructuredResult result = sampleResult();

        cache.put("NSG-0001-001", TEXT, "deepseek-chat", result);

        assertThat(cache.get("NSG-0001-001", TEXT, "deepseek-chat")).contains(result);
    }

    @Test
    @DisplayName("should key entries by document, text fingerprint and model")
    void keyComponents() {
        cache.put("NSG-0001-001", TEXT, "deepseek-chat", sampleResult());

        assertThat(cache.get("NSG-0001-002", TEXT, "deepseek-chat")).isEmpty();
        assertThat(cache.get("NSG-0001-001", TEXT, "deepseek-reasoner")).isEmpty();
        assertThat(cache.get("NSG-0001-001", TEXT + " ", "deepseek-chat")).isEmpty();
    }

    @Test
    @DisplayName("should replace an existing entry instead of duplicating it")
    void upsert() {
        cache.put("NSG-0001-001", TEXT, "deepseek-chat", StructuredResult.empty());
        cache.put("NSG-0001-001", TEXT, "deepseek-chat", sampleResult());
        cache.put("NSG-0001-001", TEXT, "deepseek-chat", sampleResult());

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("NSG-0001-001", TEXT, "deepseek-chat")).contains(sampleResult());
    }

    @Test
    @DisplayName("should treat an unreadable payload as a miss")
    void unreadablePayload() {
        jdbcTemplate.update("INSERT INTO paragraph_cache (doc_id, para_hash, model, response_json) VALUES (?, ?, ?, ?)",
                "NSG-0001-001", ContentFingerprint.of(TEXT), "deepseek-chat", "{not json");

        assertThat(cache.get("NSG-0001-001", TEXT, "deepseek-chat")).isEmpty();
    }

    @Test
    @DisplayName("should surface store failures as ResultStorageException")
    void storeFailure() {
        jdbcTemplate.execute("DROP TABLE paragraph_cache");

        assertThatThrownBy(() -> cache.get("NSG-0001-001", TEXT, "deepseek-chat"))
                .isInstanceOf(ResultStorageException.class);
        assertThatThrownBy(() -> cache.put("NSG-0001-001", TEXT, "deepseek-chat", sampleResult()))
                .isInstanceOf(ResultStorageException.class);
    }

    @Test
    @DisplayName("fingerprint should be 16 hex chars and depend only on the text")
    void fingerprint() {
        assertThat(ContentFingerprint.of(TEXT)).hasSize(16).matches("[0-9a-f]{16}");
        assertThat(ContentFingerprint.of(TEXT)).isEqualTo(ContentFingerprint.of(new String(TEXT)));
        assertThat(ContentFingerprint.of(TEXT)).isNotEqualTo(ContentFingerprint.of(TEXT + "."));
    }
}
