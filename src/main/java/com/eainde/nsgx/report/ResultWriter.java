package com.eainde.nsgx.report;

import com.eainde.nsgx.exception.ResultStorageException;
import com.eainde.nsgx.model.CandidateAggregate;
import com.eainde.nsgx.model.DocumentResult;
import com.eainde.nsgx.model.UnitResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Persists structured outputs as JSON under an {@link OutputLayout}. Write failures
 * surface as {@link ResultStorageException}.
 */
@Log4j2
public class ResultWriter {

    private final OutputLayout layout;
    private final ObjectMapper objectMapper;
    private final ObjectWriter prettyWriter;

    public ResultWriter(OutputLayout layout, ObjectMapper objectMapper) {
        this.layout = layout;
        this.objectMapper = objectMapper;
        this.prettyWriter = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public OutputLayout getLayout() {
        return layout;
    }

    public void writeUnitResult(UnitResult result) {
        writeJson(layout.unitResult(result.documentId(), result.unitId()), result);
    }

    /**
     * Writes a document result unless it already exists and {@code overwrite} is off.
     *
     * @return true if the file was written
     */
    public boolean writeDocumentResult(DocumentResult result, boolean overwrite) {
        Path target = layout.documentResult(result.documentId());
        if (!overwrite && Files.exists(target)) {
            log.info("Keeping existing {} (overwrite disabled)", target);
            return false;
        }
        writeJson(target, result);
        return true;
    }

    /**
     * Loads every document result previously written to the docs directory.
     */
    public List<DocumentResult> readDocumentResults() {
        Path dir = layout.documentsDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<DocumentResult> results = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .forEach(p -> results.add(read(p)));
        } catch (IOException | UncheckedIOException e) {
            throw new ResultStorageException("Failed to read document results from " + dir, e);
        }
        return results;
    }

    /**
     * Writes one aggregate per line.
     */
    public void writeAggregates(List<CandidateAggregate> aggregates) {
        Path target = layout.proposals();
        try {
            Files.createDirectories(target.getParent());
            StringBuilder lines = new StringBuilder();
            for (CandidateAggregate aggregate : aggregates) {
                lines.append(objectMapper.writeValueAsString(aggregate)).append('\n');
            }
            Files.writeString(target, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ResultStorageException("Failed to write " + target, e);
        }
        log.info("Wrote {} aggregates to {}", aggregates.size(), target);
    }

    public void writeSummary(String name, Object summary) {
        Path target = layout.summary(name);
        writeJson(target, summary);
        log.info("Wrote {}", target);
    }

    /**
     * Writes text unless the file exists and {@code overwrite} is off.
     *
     * @return true if the file was written
     */
    public boolean writeText(Path target, String content, boolean overwrite) {
        if (!overwrite && Files.exists(target)) {
            log.info("Keeping existing {} (overwrite disabled)", target);
            return false;
        }
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ResultStorageException("Failed to write " + target, e);
        }
        return true;
    }

    private void writeJson(Path target, Object value) {
        try {
            Files.createDirectories(target.getParent());
            prettyWriter.writeValue(target.toFile(), value);
        } catch (IOException e) {
            throw new ResultStorageException("Failed to write " + target, e);
        }
    }

    private DocumentResult read(Path path) {
        try {
            return objectMapper.readValue(path.toFile(), DocumentResult.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable document result " + path, e);
        }
    }
}
