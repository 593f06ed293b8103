package eu.virtualparadox.documind.ingest.extractor;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

/**
 * Turns the bytes of one file format into plain text.
 */
public interface TextExtractor {

    /**
     * @return lower-case extensions including the dot, e.g. {@code .pdf}
     */
    Set<String> supportedExtensions();

    /**
     * @param content file content; the caller closes the stream
     * @return extracted text, possibly blank
     * @throws IOException if the content cannot be read or parsed
     */
    String extractText(final InputStream content) throws IOException;

}
