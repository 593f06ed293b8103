package eu.virtualparadox.documind.ingest.extractor;

/**
 * An uploaded file cannot be turned into indexable text.
 */
public class UnsupportedFormatException extends RuntimeException {

    public enum EReason {
        /** No extractor is registered for the file extension. */
        UNKNOWN_FORMAT,
        /** The file could not be read, or it yields no usable text or chunks. */
        NO_USABLE_TEXT
    }

    private final EReason reason;

    public UnsupportedFormatException(final EReason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public UnsupportedFormatException(final EReason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public EReason getReason() {
        return reason;
    }
}
