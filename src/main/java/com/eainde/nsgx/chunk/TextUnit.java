package com.eainde.nsgx.chunk;

/**
 * A bounded slice of one document's text, submitted to extraction as a unit.
 *
 * <p>Unit ids are assigned ordinally ({@code chunk_000}, {@code chunk_001}, ...) and
 * are stable for a given document and segmentation limit.</p>
 *
 * @param documentId  id of the source document
 * @param unitId      zero-padded ordinal id
 * @param text        trimmed, non-empty unit text
 */
public record TextUnit(String documentId, String unitId, String text) {

    private static final String UNIT_ID_FORMAT = "chunk_%03d";

    public static TextUnit of(String documentId, int ordinal, String text) {
        return new TextUnit(documentId, String.format(UNIT_ID_FORMAT, ordinal), text);
    }

    /**
     * @return length of the unit text in characters
     */
    public int length() {
        return text.length();
    }
}
