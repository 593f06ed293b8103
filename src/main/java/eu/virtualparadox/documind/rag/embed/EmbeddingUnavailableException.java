package eu.virtualparadox.documind.rag.embed;

/**
 * The embedding model could not produce a vector (not loaded, inference failure, bad output).
 */
public class EmbeddingUnavailableException extends IllegalStateException {

    public EmbeddingUnavailableException(final String message) {
        super(message);
    }

    public EmbeddingUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
