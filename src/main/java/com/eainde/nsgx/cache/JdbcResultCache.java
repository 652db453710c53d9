package com.eainde.nsgx.cache;

import com.eainde.nsgx.exception.ResultStorageException;
import com.eainde.nsgx.model.StructuredResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * {@link ResultCache} backed by a {@code paragraph_cache} table.
 *
 * <p>Writes are single-statement upserts ({@code MERGE ... KEY}) run in a
 * SERIALIZABLE transaction, so concurrent writers of the same key cannot corrupt
 * the row and the last writer wins with an identical payload. Reads run without
 * a transaction.</p>
 *
 * <p>A payload that no longer deserializes is treated as a miss and logged; the
 * next successful extraction overwrites it.</p>
 */
@Log4j2
public class JdbcResultCache implements ResultCache {

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS paragraph_cache (
                doc_id        VARCHAR(255) NOT NULL,
                para_hash     VARCHAR(64)  NOT NULL,
                model         VARCHAR(128) NOT NULL,
                response_json CLOB         NOT NULL,
                created_at    TIMESTAMP    DEFAULT CURRENT_TIMESTAMP NOT NULL,
                PRIMARY KEY (doc_id, para_hash, model)
            )
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate writeTransaction;
    private final ObjectMapper objectMapper;

    public JdbcResultCache(JdbcTemplate jdbcTemplate,
                           PlatformTransactionManager transactionManager,
                           ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
    }

    public void initializeSchema() {
        jdbcTemplate.execute(CREATE_TABLE);
        log.info("Result cache ready ({} entries)", size());
    }

    @Override
    public Optional<StructuredResult> get(String documentId, String unitText, String modelId) {
        String json;
        try {
            json = jdbcTemplate.queryForObject(
                    "SELECT response_json FROM paragraph_cache WHERE doc_id = ? AND para_hash = ? AND model = ?",
                    String.class,
                    documentId,
                    ContentFingerprint.of(unitText),
                    modelId);
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new ResultStorageException("Failed to read cache entry for " + documentId, e);
        }
        try {
            return Optional.of(objectMapper.readValue(json, StructuredResult.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable cache entry for {} / {}: {}", documentId, modelId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String documentId, String unitText, String modelId, StructuredResult result) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new ResultStorageException("Failed to serialize result for " + documentId, e);
        }
        String fingerprint = ContentFingerprint.of(unitText);
        try {
            writeTransaction.executeWithoutResult(status -> jdbcTemplate.update("""
                    MERGE INTO paragraph_cache (doc_id, para_hash, model, response_json, created_at)
                    KEY (doc_id, para_hash, model)
                    VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)
                    """, documentId, fingerprint, modelId, json));
        } catch (DataAccessException e) {
            throw new ResultStorageException("Failed to write cache entry for " + documentId, e);
        }
        log.debug("Cached {} / {} / {}", documentId, fingerprint, modelId);
    }

    public int size() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM paragraph_cache", Integer.class);
        return count != null ? count : 0;
    }
}
