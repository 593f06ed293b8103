package eu.virtualparadox.documind.ingest.chunker;

import eu.virtualparadox.documind.ingest.model.Chunk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Boundary-aware text {@code Chunker} that produces overlapping chunks for the retrieval index.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Short input:</strong> text not longer than {@code chunkSize} becomes exactly one
 *       chunk holding the trimmed text.</li>
 *   <li><strong>Sliding window:</strong> longer text is covered by windows of {@code chunkSize}
 *       characters. Each window start is the previous window end minus {@code overlap}, so
 *       consecutive chunks share up to {@code overlap} characters.</li>
 *   <li><strong>Boundary selection:</strong> before a window is emitted its end is pulled back to
 *       just after the last {@code '.'} inside the window, provided that period lies in the second
 *       half of the window. Failing that, the last line break under the same condition is used.
 *       Otherwise the raw window end is kept.</li>
 *   <li><strong>Noise suppression:</strong> candidates whose trimmed length is at most
 *       {@link #MIN_CHUNK_CHARS} characters are dropped.</li>
 * </ul>
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * This component is stateless after construction and thus thread-safe. For a given input the
 * output is deterministic.
 *
 * @implNote {@code overlap} is capped at {@code chunkSize / 2}. A boundary is only accepted beyond
 *           the middle of the window, so the next start always lies after the current one.
 */
@Component
public class Chunker {

    /**
     * Trimmed candidates of this length or shorter are considered noise and discarded.
     */
    public static final int MIN_CHUNK_CHARS = 50;

    private static final char SENTENCE_TERMINATOR = '.';
    private static final char LINE_BREAK = '\n';

    /**
     * Window size in characters.
     */
    private final int chunkSize;

    /**
     * Number of characters the next window reaches back into the previous one.
     */
    private final int overlap;

    /**
     * Constructs a {@code Chunker}.
     *
     * @param chunkSize window size in characters (must be {@code > 0})
     * @param overlap   characters shared between consecutive windows
     *                  (must be {@code >= 0} and {@code <= chunkSize / 2})
     * @throws IllegalArgumentException if constraints are violated
     */
    public Chunker(@Value("${documind.chunker.chunk-size:500}") final int chunkSize,
                   @Value("${documind.chunker.overlap:100}") final int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlap < 0 || overlap > chunkSize / 2) {
            throw new IllegalArgumentException("overlap must be non-negative and at most chunkSize / 2");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    /**
     * Splits the text of a document and wraps every piece into a {@link Chunk} with a stable id
     * and its 0-based index.
     *
     * @param docId document identifier (non-blank)
     * @param text  extracted document text (non-null)
     * @return ordered chunks of the document
     * @throws IllegalArgumentException if inputs are invalid
     */
    public List<Chunk> chunk(final String docId, final String text) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }

        final List<String> pieces = split(text);
        final List<Chunk> result = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            result.add(new Chunk(docId, buildChunkId(docId, i), i, pieces.get(i)));
        }
        return result;
    }

    /**
     * Splits {@code text} into overlapping chunk strings.
     *
     * @param text input text (non-null)
     * @return ordered chunk strings
     * @throws IllegalArgumentException if {@code text} is null
     */
    public List<String> split(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }

        final List<String> result = new ArrayList<>();
        if (text.length() <= chunkSize) {
            result.add(text.trim());
            return result;
        }

        final int length = text.length();
        int start = 0;
        while (start < length) {
            int end = start + chunkSize;

            if (end < length) {
                end = boundaryEnd(text, start, end);
            }

            final String candidate = text.substring(start, Math.min(end, length)).trim();
            if (candidate.length() > MIN_CHUNK_CHARS) {
                result.add(candidate);
            }

            start = Math.max(end - overlap, start + 1);
        }
        return result;
    }

    /**
     * Picks the end of the window {@code [start, end)}: just after the last sentence terminator,
     * else just after the last line break, as long as the boundary lies in the second half of
     * the window.
     */
    private int boundaryEnd(final String text, final int start, final int end) {
        final int threshold = start + chunkSize / 2;

        final int sentenceEnd = lastIndexOf(text, SENTENCE_TERMINATOR, start, end);
        if (sentenceEnd > threshold) {
            return sentenceEnd + 1;
        }

        final int lineEnd = lastIndexOf(text, LINE_BREAK, start, end);
        if (lineEnd > threshold) {
            return lineEnd + 1;
        }
        return end;
    }

    /**
     * Last position of {@code c} in {@code [from, to)}, or {@code -1}.
     */
    private static int lastIndexOf(final String text, final char c, final int from, final int to) {
        final int idx = text.lastIndexOf(c, to - 1);
        return idx >= from ? idx : -1;
    }

    /**
     * Builds a stable chunk identifier:
     * <pre>
     *   {docId}_{seq(5 digits)}
     * </pre>
     *
     * @param docId document id
     * @param seq   zero-based sequence number
     * @return chunk id string
     */
    private static String buildChunkId(final String docId, final int seq) {
        return docId + "_" + String.format("%05d", seq);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }
}
