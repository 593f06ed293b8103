package eu.virtualparadox.documind.catalog;

public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(final String id) {
        super("Document not found: " + id);
    }
}
