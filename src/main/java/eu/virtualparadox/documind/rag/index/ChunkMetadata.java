package eu.virtualparadox.documind.rag.index;

import java.time.Instant;

/**
 * Filterable metadata denormalised onto every index entry.
 *
 * @param docId      parent document identifier
 * @param ownerId    identifier of the user who uploaded the document
 * @param chunkIndex 0-based position of the chunk inside its document
 * @param filename   original file name, used for display and source footers
 * @param fileType   lower-case file extension including the dot (e.g. {@code .pdf})
 * @param uploadedAt upload timestamp of the parent document
 */
public record ChunkMetadata(String docId,
                            String ownerId,
                            int chunkIndex,
                            String filename,
                            String fileType,
                            Instant uploadedAt) {
}
