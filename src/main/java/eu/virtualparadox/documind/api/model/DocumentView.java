package eu.virtualparadox.documind.api.model;

import eu.virtualparadox.documind.catalog.EDocumentStatus;
import eu.virtualparadox.documind.catalog.entity.DocumentEntity;

import java.time.Instant;

public record DocumentView(String id,
                           String filename,
                           String fileType,
                           long sizeBytes,
                           Instant uploadedAt,
                           int chunks,
                           EDocumentStatus status) {

    public static DocumentView from(final DocumentEntity entity) {
        return new DocumentView(entity.getId(), entity.getFilename(), entity.getFileType(),
                entity.getSizeBytes(), entity.getUploadedAt(), entity.getChunks(), entity.getStatus());
    }
}
