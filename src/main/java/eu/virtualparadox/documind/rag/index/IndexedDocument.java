package eu.virtualparadox.documind.rag.index;

import java.time.Instant;

/**
 * Per-document view of the index, grouped from chunk metadata.
 */
public record IndexedDocument(String docId,
                              String ownerId,
                              String filename,
                              String fileType,
                              Instant uploadedAt,
                              int chunkCount) {
}
