package com.eainde.nsgx.cache;

import com.eainde.nsgx.model.StructuredResult;

import java.util.Optional;

/**
 * Durable store of extraction results keyed by
 * {@code (documentId, fingerprint(unitText), modelId)}. Entries never expire.
 */
public interface ResultCache {

    Optional<StructuredResult> get(String documentId, String unitText, String modelId);

    /**
     * Stores or replaces the entry for the key.
     *
     * @throws com.eainde.nsgx.exception.ResultStorageException if the write fails
     */
    void put(String documentId, String unitText, String modelId, StructuredResult result);
}
