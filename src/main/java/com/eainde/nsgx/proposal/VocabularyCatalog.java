package com.eainde.nsgx.proposal;

import com.eainde.nsgx.exception.CatalogLoadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of known vocabulary: enum name to accepted values, plus the
 * mapping from candidate categories to enum names.
 *
 * <pre>
 * activities  → aktivitaet
 * zone_terms  → zone_typ
 * place_terms → ort
 * </pre>
 */
public final class VocabularyCatalog {

    public static final Map<String, String> DEFAULT_CATEGORY_ENUMS = Map.of(
            "activities", "aktivitaet",
            "zone_terms", "zone_typ",
            "place_terms", "ort");

    private final Map<String, List<String>> enums;
    private final Map<String, String> categoryEnums;

    public VocabularyCatalog(Map<String, List<String>> enums, Map<String, String> categoryEnums) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        enums.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.enums = Collections.unmodifiableMap(copy);
        this.categoryEnums = Map.copyOf(categoryEnums);
    }

    public static VocabularyCatalog of(Map<String, List<String>> enums) {
        return new VocabularyCatalog(enums, DEFAULT_CATEGORY_ENUMS);
    }

    /**
     * Reads a JSON object of the form {@code {"aktivitaet": ["klettern", ...], ...}}.
     */
    public static VocabularyCatalog load(InputStream in, ObjectMapper objectMapper) {
        try {
            Map<String, List<String>> enums = objectMapper.readValue(in,
                    new TypeReference<LinkedHashMap<String, List<String>>>() {});
            return of(enums);
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read known vocabulary", e);
        }
    }

    /**
     * @return known values of the enum the category maps to, or empty for an
     *         unknown category
     */
    public Optional<List<String>> knownValues(String category) {
        String enumName = categoryEnums.get(category);
        return enumName == null ? Optional.empty() : Optional.ofNullable(enums.get(enumName));
    }

    public Map<String, List<String>> getEnums() {
        return enums;
    }

    public String toJson(ObjectMapper objectMapper) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(enums);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize catalog", e);
        }
    }
}
