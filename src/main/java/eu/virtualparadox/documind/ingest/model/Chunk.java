package eu.virtualparadox.documind.ingest.model;

/**
 * Immutable representation of a text chunk produced by extraction + chunking.
 * <p>Contains the parent document id, chunk id, the 0-based position of the chunk inside its
 * document and the text to be embedded.</p>
 */
public record Chunk(String docId, String chunkId, int index, String text) {
}
