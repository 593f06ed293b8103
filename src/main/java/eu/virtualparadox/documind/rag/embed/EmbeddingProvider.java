package eu.virtualparadox.documind.rag.embed;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Computes dense vector embeddings of a fixed dimension.
 * <p>
 * {@link #embed(String)} and {@link #embedBatch(List)} fail with
 * {@link EmbeddingUnavailableException}; callers that prefer availability over quality use
 * {@link #embedOrZero(String)}, which substitutes the all-zero vector of length {@link #dimension()}.
 * A vector of the wrong length is never replaced: it fails with
 * {@link eu.virtualparadox.documind.rag.index.DimensionMismatchException}.
 */
public interface EmbeddingProvider {

    /**
     * Embeds a single string into dense vector space.
     *
     * @param text the text (non-null)
     * @return a vector of length {@link #dimension()}
     * @throws EmbeddingUnavailableException if the model cannot produce a vector
     */
    float[] embed(String text);

    /**
     * Embeds the given texts in batch.
     *
     * @param texts list of texts
     * @return list of float vectors, one per text, same order
     * @throws EmbeddingUnavailableException if the model cannot produce the vectors
     */
    List<float[]> embedBatch(List<String> texts);

    /**
     * @return the fixed length of every vector produced by this provider
     */
    int dimension();

    /**
     * Like {@link #embed(String)}, but returns the zero vector instead of failing.
     */
    default float[] embedOrZero(final String text) {
        try {
            return embed(text);
        } catch (final EmbeddingUnavailableException e) {
            Fallback.log.warn("Embedding unavailable, substituting zero vector: {}", e.getMessage());
            return new float[dimension()];
        }
    }

    /**
     * Logger holder for the default methods.
     */
    @Slf4j
    final class Fallback {
        private Fallback() {
        }
    }
}
