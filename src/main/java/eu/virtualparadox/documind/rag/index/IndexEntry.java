package eu.virtualparadox.documind.rag.index;

/**
 * One chunk as stored in the vector index.
 *
 * @param chunkId  unique chunk identifier; re-adding the same id replaces the entry
 * @param text     chunk text, kept for answer synthesis and content reconstruction
 * @param vector   dense embedding of {@code text}
 * @param metadata filterable metadata
 */
public record IndexEntry(String chunkId, String text, float[] vector, ChunkMetadata metadata) {
}
