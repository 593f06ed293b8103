package eu.virtualparadox.documind.ingest.model;

import eu.virtualparadox.documind.catalog.EDocumentStatus;

/**
 * Outcome of a successful upload.
 */
public record UploadResult(String documentId,
                           String filename,
                           EDocumentStatus status,
                           String message,
                           int chunks) {
}
