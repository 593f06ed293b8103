package eu.virtualparadox.documind.metrics;

public enum EDocumentAction {
    UPLOAD,
    QUERY,
    VIEW,
    DELETE,
    SUMMARIZE
}
