package com.eainde.nsgx.pipeline;

import java.nio.file.Path;

/**
 * Plain text of one regulation document.
 *
 * @param documentId stable id, see {@link TextDocumentSource#documentIdOf(Path)}
 * @param path       file the text was read from
 * @param text       full text
 */
public record SourceDocument(String documentId, Path path, String text) {
}
