package com.eainde.nsgx.pipeline;

import com.eainde.nsgx.exception.DocumentSourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextDocumentSourceTest {

    @TempDir
    Path dir;

    private final TextDocumentSource source = new TextDocumentSource();

    @Test
    @DisplayName("should read every .txt file below the directory in path order")
    void loads() throws Exception {
        Files.writeString(dir.resolve("NSG-0002-001_Verordnung.txt"), "Zweite", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("NSG-0001-001_Verordnung.txt"), "Erste Verordnung über das Gebiet",
                StandardCharsets.UTF_8);
        Files.createDirectories(dir.resolve("sub"));
        Files.writeString(dir.resolve("sub/moorwiesen.txt"), "Dritte", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("notes.md"), "ignored", StandardCharsets.UTF_8);

        List<SourceDocument> documents = source.load(dir);

        assertThat(documents).extracting(SourceDocument::documentId)
                .containsExactly("NSG-0001-001", "NSG-0002-001", "moorwiesen");
        assertThat(documents.get(0).text()).isEqualTo("Erste Verordnung über das Gebiet");
    }

    @Test
    @DisplayName("should keep the first file when two share a document id")
    void duplicateIds() throws Exception {
        Files.writeString(dir.resolve("a_NSG-0001-001.txt"), "first");
        Files.writeString(dir.resolve("b_NSG-0001-001.txt"), "second");

        List<SourceDocument> documents = source.load(dir);

        assertThat(documents).singleElement().extracting(SourceDocument::text).isEqualTo("first");
    }

    @Test
    @DisplayName("should skip a file that is not valid UTF-8 and keep loading the others")
    void skipsUndecodableFile() throws Exception {
        Files.write(dir.resolve("NSG-0001-001.txt"), new byte[]{'G', (byte) 0xE4, 'r', 't', 'e', 'n'});
        Files.writeString(dir.resolve("NSG-0002-001.txt"), "Gärten dürfen nicht betreten werden.",
                StandardCharsets.UTF_8);

        List<SourceDocument> documents = source.load(dir);

        assertThat(documents).singleElement().satisfies(document -> {
            assertThat(document.documentId()).isEqualTo("NSG-0002-001");
            assertThat(document.text()).isEqualTo("Gärten dürfen nicht betreten werden.");
        });
    }

    @Test
    @DisplayName("should fall back to a later file with the same id when the first cannot be read")
    void duplicateAfterUnreadable() throws Exception {
        Files.write(dir.resolve("a_NSG-0001-001.txt"), new byte[]{(byte) 0xFF, (byte) 0xFE, 0x41});
        Files.writeString(dir.resolve("b_NSG-0001-001.txt"), "second");

        assertThat(source.load(dir)).singleElement().extracting(SourceDocument::text).isEqualTo("second");
    }

    @Test
    @DisplayName("should return nothing for an empty directory")
    void empty() {
        assertThat(source.load(dir)).isEmpty();
    }

    @Test
    @DisplayName("should fail when the directory does not exist")
    void missingDirectory() {
        assertThatThrownBy(() -> source.load(dir.resolve("missing")))
                .isInstanceOf(DocumentSourceException.class)
                .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("should derive document ids from file names")
    void documentIds() {
        assertThat(TextDocumentSource.documentIdOf(Path.of("in/NSG-1234-567_Text.txt"))).isEqualTo("NSG-1234-567");
        assertThat(TextDocumentSource.documentIdOf(Path.of("in/moorwiesen.txt"))).isEqualTo("moorwiesen");
        assertThat(TextDocumentSource.documentIdOf(Path.of("in/README"))).isEqualTo("README");
    }
}
