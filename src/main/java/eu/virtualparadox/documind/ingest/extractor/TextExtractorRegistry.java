package eu.virtualparadox.documind.ingest.extractor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException.EReason.NO_USABLE_TEXT;
import static eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException.EReason.UNKNOWN_FORMAT;

/**
 * Selects the {@link TextExtractor} for a file by its extension.
 */
@Slf4j
@Component
public class TextExtractorRegistry {

    private final Map<String, TextExtractor> byExtension = new HashMap<>();

    public TextExtractorRegistry(final List<TextExtractor> extractors) {
        for (final TextExtractor extractor : extractors) {
            for (final String ext : extractor.supportedExtensions()) {
                final TextExtractor previous = byExtension.put(ext.toLowerCase(Locale.ROOT), extractor);
                if (previous != null) {
                    throw new IllegalStateException("Two extractors registered for " + ext);
                }
            }
        }
        log.info("Registered text extractors for {}", byExtension.keySet());
    }

    public Set<String> supportedExtensions() {
        return Set.copyOf(byExtension.keySet());
    }

    public boolean supports(final String fileType) {
        return fileType != null && byExtension.containsKey(fileType.toLowerCase(Locale.ROOT));
    }

    /**
     * Extracts the text of a file.
     *
     * @param fileType lower-case extension including the dot
     * @param content  file content; the caller closes the stream
     * @return non-blank text
     * @throws UnsupportedFormatException if the extension is unknown, the file is unreadable
     *                                    or it contains no text
     */
    public String extract(final String fileType, final InputStream content) {
        final TextExtractor extractor = fileType == null ? null : byExtension.get(fileType.toLowerCase(Locale.ROOT));
        if (extractor == null) {
            throw new UnsupportedFormatException(UNKNOWN_FORMAT, "Unsupported file format: " + fileType);
        }

        final String text;
        try {
            text = extractor.extractText(content);
        } catch (final IOException | RuntimeException e) {
            throw new UnsupportedFormatException(NO_USABLE_TEXT, "Error processing " + fileType + " file: " + e.getMessage(), e);
        }

        if (text == null || text.isBlank()) {
            throw new UnsupportedFormatException(NO_USABLE_TEXT, "No text content could be extracted from the file");
        }
        return text;
    }
}
