package eu.virtualparadox.documind.catalog;

/**
 * The document exists but belongs to another owner.
 */
public class DocumentAccessDeniedException extends RuntimeException {

    public DocumentAccessDeniedException(final String id) {
        super("Access denied to document: " + id);
    }
}
