package eu.virtualparadox.documind.rag.retriever.model;

import eu.virtualparadox.documind.rag.index.ChunkMetadata;

/**
 * @param chunkId    Identifier of the chunk inside the document.
 * @param text       The chunk text (retrieved from Lucene).
 * @param metadata   Metadata stored alongside the chunk.
 * @param similarity Cosine similarity to the query, {@code 1 - cosineDistance} (higher = better).
 */
public record SearchResult(String chunkId, String text, ChunkMetadata metadata, float similarity) {

    public String docId() {
        return metadata.docId();
    }

    public String filename() {
        return metadata.filename();
    }
}
