package com.eainde.nsgx.chunk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits regulation text into bounded units for extraction, preferring legal
 * section headers, then blank-line paragraphs, then sentence ends.
 *
 * <h3>Policy (in priority order):</h3>
 * <ol>
 *   <li>Text within {@code maxUnitChars} is returned unchanged as one unit.</li>
 *   <li>Split before each section header ({@code § 3}, {@code §12}); consecutive
 *       sections are accumulated while the combined unit still fits.</li>
 *   <li>Units still over the limit are re-split at blank lines, accumulating
 *       paragraphs up to the limit.</li>
 *   <li>Remaining oversized units are re-split at sentence ends the same way.</li>
 *   <li>Empty units are discarded.</li>
 * </ol>
 *
 * <p>A single sentence longer than the limit is emitted as-is; content is never
 * truncated. Output depends only on the input text and the limit.</p>
 *
 * <pre>
 * DocumentSegmenter segmenter = DocumentSegmenter.builder()
 *         .maxUnitChars(4000)
 *         .build();
 * List&lt;TextUnit&gt; units = segmenter.segment("NSG-1234-001", text);
 * </pre>
 *
 * <p>Pure logic with no Spring dependencies.</p>
 */
public class DocumentSegmenter {

    private static final Logger log = LoggerFactory.getLogger(DocumentSegmenter.class);

    public static final int DEFAULT_MAX_UNIT_CHARS = 4000;

    /** Line starting with a section sign and a number: "§ 4", "  §12 Verbote". */
    private static final Pattern SECTION_HEADER = Pattern.compile("\\n\\s*§\\s*\\d+");

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    private final int maxUnitChars;

    private DocumentSegmenter(Builder builder) {
        if (builder.maxUnitChars <= 0) {
            throw new IllegalArgumentException("maxUnitChars must be > 0, was " + builder.maxUnitChars);
        }
        this.maxUnitChars = builder.maxUnitChars;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Segments a document into ordered text units.
     *
     * @param documentId id carried into every unit
     * @param text       full document text
     * @return ordered units, empty if the text is blank
     */
    public List<TextUnit> segment(String documentId, String text) {
        List<String> pieces = split(text);
        List<TextUnit> units = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            units.add(TextUnit.of(documentId, i, pieces.get(i)));
        }
        log.debug("Document {} segmented into {} units (maxUnitChars={})",
                documentId, units.size(), maxUnitChars);
        return Collections.unmodifiableList(units);
    }

    /**
     * Splits text into unit strings without assigning ids.
     *
     * @param text the text to split; null is treated as empty
     * @return non-empty strings in document order
     */
    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        if (text.length() <= maxUnitChars) {
            return List.of(text);
        }

        List<String> result = new ArrayList<>();
        for (String unit : accumulate(splitBeforeSections(text), "\n")) {
            if (unit.length() <= maxUnitChars) {
                result.add(unit);
                continue;
            }
            for (String paragraphUnit : accumulate(PARAGRAPH_BREAK.split(unit), "\n\n")) {
                if (paragraphUnit.length() <= maxUnitChars) {
                    result.add(paragraphUnit);
                } else {
                    result.addAll(accumulate(SENTENCE_END.split(paragraphUnit), " "));
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    public int getMaxUnitChars() {
        return maxUnitChars;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    /**
     * Cuts the text immediately before every section header, so each piece starts
     * with its header and carries the body up to the next one.
     */
    private static List<String> splitBeforeSections(String text) {
        List<String> sections = new ArrayList<>();
        Matcher matcher = SECTION_HEADER.matcher(text);
        int start = 0;
        while (matcher.find()) {
            if (matcher.start() > start) {
                sections.add(text.substring(start, matcher.start()));
            }
            start = matcher.start();
        }
        sections.add(text.substring(start));
        return sections;
    }

    /**
     * Greedily packs pieces into units: a piece joins the current unit while the
     * joined text fits, otherwise the current unit is closed and the piece starts
     * the next one. Blank pieces are skipped and every unit is trimmed.
     */
    private List<String> accumulate(Iterable<String> pieces, String separator) {
        List<String> units = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String raw : pieces) {
            String piece = raw.strip();
            if (piece.isEmpty()) {
                continue;
            }
            if (current.length() > 0
                    && current.length() + separator.length() + piece.length() > maxUnitChars) {
                units.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(separator);
            }
            current.append(piece);
        }
        if (current.length() > 0) {
            units.add(current.toString());
        }
        return units;
    }

    private List<String> accumulate(String[] pieces, String separator) {
        return accumulate(List.of(pieces), separator);
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxUnitChars = DEFAULT_MAX_UNIT_CHARS;

        public Builder maxUnitChars(int maxUnitChars) {
            this.maxUnitChars = maxUnitChars;
            return this;
        }

        public DocumentSegmenter build() {
            return new DocumentSegmenter(this);
        }
    }
}
