package eu.virtualparadox.documind.rag.answer;

/**
 * The completion provider failed, timed out or returned nothing.
 */
public class SynthesisUnavailableException extends RuntimeException {

    public SynthesisUnavailableException(final String message) {
        super(message);
    }

    public SynthesisUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
