package com.eainde.nsgx.pipeline;

import com.eainde.nsgx.exception.DocumentSourceException;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads {@code *.txt} files below a directory as {@link SourceDocument}s, in path order.
 * A file that cannot be read as UTF-8 text is skipped with a warning; the rest still load.
 */
@Log4j2
public class TextDocumentSource {

    static final Pattern DOCUMENT_ID = Pattern.compile("NSG-\\d{4}-\\d{3}");

    public List<SourceDocument> load(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new DocumentSourceException("Input directory does not exist: " + directory);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".txt"))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new DocumentSourceException("Failed to list input directory " + directory, e);
        }

        Map<String, SourceDocument> byId = new LinkedHashMap<>();
        int unreadable = 0;
        for (Path file : files) {
            String documentId = documentIdOf(file);
            if (byId.containsKey(documentId)) {
                log.warn("Skipping {}: document id {} already read from {}",
                        file, documentId, byId.get(documentId).path());
                continue;
            }
            Optional<String> text = read(file);
            if (text.isEmpty()) {
                unreadable++;
                continue;
            }
            byId.put(documentId, new SourceDocument(documentId, file, text.get()));
        }
        if (unreadable > 0) {
            log.warn("Skipped {} unreadable files in {}", unreadable, directory);
        }

        if (byId.isEmpty()) {
            log.warn("No .txt documents found in {}", directory);
        } else {
            log.info("Loaded {} documents from {}", byId.size(), directory);
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * {@code NSG-dddd-ddd} from the file name if present, otherwise the file name
     * without extension.
     */
    public static String documentIdOf(Path file) {
        String name = file.getFileName().toString();
        Matcher matcher = DOCUMENT_ID.matcher(name);
        if (matcher.find()) {
            return matcher.group();
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static Optional<String> read(Path file) {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (MalformedInputException e) {
            log.warn("Skipping {}: not valid UTF-8 text", file);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Skipping {}: {}", file, e.toString());
            return Optional.empty();
        }
    }
}
