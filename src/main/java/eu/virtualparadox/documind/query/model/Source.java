package eu.virtualparadox.documind.query.model;

import eu.virtualparadox.documind.rag.retriever.model.SearchResult;

/**
 * A retrieved chunk as reported to the caller.
 */
public record Source(String documentId,
                     String chunkId,
                     String filename,
                     String fileType,
                     float similarity,
                     String preview) {

    static final int PREVIEW_LENGTH = 200;

    public static Source from(final SearchResult result) {
        final String text = result.text() == null ? "" : result.text();
        final String preview = text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
        return new Source(result.docId(), result.chunkId(), result.filename(),
                result.metadata().fileType(), result.similarity(), preview);
    }
}
