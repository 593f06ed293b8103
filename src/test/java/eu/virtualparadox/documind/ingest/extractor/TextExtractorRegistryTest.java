package eu.virtualparadox.documind.ingest.extractor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TextExtractorRegistryTest {

    private final TextExtractorRegistry registry = new TextExtractorRegistry(List.of(
            new PlainTextExtractor(), new PdfTextExtractor(), new CsvTextExtractor(),
            new DocxTextExtractor(), new XlsxTextExtractor()));

    private static InputStream utf8(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Extensions are matched case-insensitively")
    void supports() {
        assertEquals(Set.of(".txt", ".md", ".pdf", ".csv", ".docx", ".xlsx"), registry.supportedExtensions());
        assertTrue(registry.supports(".DOCX"));
        assertTrue(registry.supports(".TXT"));
        assertTrue(registry.supports(".pdf"));
        assertFalse(registry.supports(".exe"));
        assertFalse(registry.supports(""));
        assertFalse(registry.supports(null));
    }

    @Test
    @DisplayName("Plain text and markdown are read as UTF-8")
    void plainText() {
        assertEquals("Grüße aus Köln", registry.extract(".txt", utf8("Grüße aus Köln")));
        assertEquals("# Title\n\nBody", registry.extract(".md", utf8("# Title\n\nBody")));
    }

    @Test
    @DisplayName("Unknown formats are rejected with UNKNOWN_FORMAT")
    void unknownFormat() {
        UnsupportedFormatException ex = assertThrows(UnsupportedFormatException.class,
                () -> registry.extract(".exe", utf8("MZ")));

        assertEquals(UnsupportedFormatException.EReason.UNKNOWN_FORMAT, ex.getReason());
    }

    @Test
    @DisplayName("Files without text are rejected with NO_USABLE_TEXT")
    void noText() {
        UnsupportedFormatException ex = assertThrows(UnsupportedFormatException.class,
                () -> registry.extract(".txt", utf8(" \n\t ")));

        assertEquals(UnsupportedFormatException.EReason.NO_USABLE_TEXT, ex.getReason());
    }

    @Test
    @DisplayName("Unreadable files are rejected with NO_USABLE_TEXT")
    void corruptFile() {
        UnsupportedFormatException ex = assertThrows(UnsupportedFormatException.class,
                () -> registry.extract(".pdf", utf8("definitely not a pdf")));

        assertEquals(UnsupportedFormatException.EReason.NO_USABLE_TEXT, ex.getReason());
        assertThat(ex.getMessage()).startsWith("Error processing .pdf file");
    }

    @Test
    @DisplayName("Two extractors claiming one extension are a configuration error")
    void duplicateExtension() {
        TextExtractor other = new TextExtractor() {
            @Override
            public Set<String> supportedExtensions() {
                return Set.of(".TXT");
            }

            @Override
            public String extractText(InputStream content) throws IOException {
                return "";
            }
        };

        assertThrows(IllegalStateException.class,
                () -> new TextExtractorRegistry(List.of(new PlainTextExtractor(), other)));
    }
}
