package eu.virtualparadox.documind.ingest.extractor;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Reads {@code .txt} and {@code .md} files as UTF-8.
 */
@Component
public final class PlainTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedExtensions() {
        return Set.of(".txt", ".md");
    }

    @Override
    public String extractText(final InputStream content) throws IOException {
        return new String(content.readAllBytes(), StandardCharsets.UTF_8);
    }
}
