package eu.virtualparadox.documind.catalog;

public enum EDocumentStatus {
    PROCESSING,
    INDEXED,
    FAILED
}
