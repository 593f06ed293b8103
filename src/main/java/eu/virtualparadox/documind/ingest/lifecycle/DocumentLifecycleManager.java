package eu.virtualparadox.documind.ingest.lifecycle;

import eu.virtualparadox.documind.catalog.EDocumentStatus;
import eu.virtualparadox.documind.catalog.entity.DocumentEntity;
import eu.virtualparadox.documind.catalog.service.DocumentCatalogService;
import eu.virtualparadox.documind.ingest.cleaner.TextCleaner;
import eu.virtualparadox.documind.ingest.extractor.TextExtractorRegistry;
import eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException;
import eu.virtualparadox.documind.ingest.model.Chunk;
import eu.virtualparadox.documind.ingest.model.UploadResult;
import eu.virtualparadox.documind.metrics.EDocumentAction;
import eu.virtualparadox.documind.metrics.MetricsSink;
import eu.virtualparadox.documind.rag.index.IndexingService;
import eu.virtualparadox.documind.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException.EReason.NO_USABLE_TEXT;
import static eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException.EReason.UNKNOWN_FORMAT;

/**
 * Manages the full lifecycle of documents:
 * <ul>
 *   <li>Catalog (database)</li>
 *   <li>Vector index (Lucene)</li>
 * </ul>
 * An upload is extracted, cleaned, stored and indexed before the call returns.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentLifecycleManager {

    private final DocumentCatalogService catalogService;
    private final TextExtractorRegistry extractorRegistry;
    private final TextCleaner textCleaner;
    private final IndexingService indexingService;
    private final VectorIndexService vectorIndexService;
    private final MetricsSink metricsSink;

    /**
     * Ingests an uploaded file.
     * <p>
     * Files without usable text are rejected and leave no trace. A failure while indexing keeps
     * the catalog record in {@link EDocumentStatus#FAILED} state and rethrows the error.
     *
     * @param ownerId   uploading user
     * @param filename  original filename, its extension selects the extractor
     * @param sizeBytes size of the upload
     * @param content   file content; the caller closes the stream
     * @return the indexed document
     * @throws UnsupportedFormatException if the file type is unknown or yields no chunks
     * @throws IllegalArgumentException   if the owner is blank
     */
    public UploadResult upload(final String ownerId,
                               final String filename,
                               final long sizeBytes,
                               final InputStream content) {
        requireOwner(ownerId);
        final String fileType = DocumentCatalogService.fileExtension(filename);
        if (!extractorRegistry.supports(fileType)) {
            throw new UnsupportedFormatException(UNKNOWN_FORMAT, "Unsupported file format: " + fileType);
        }

        final String text = textCleaner.cleanText(extractorRegistry.extract(fileType, content));
        if (text.isEmpty()) {
            throw new UnsupportedFormatException(NO_USABLE_TEXT, "No text content could be extracted from the file");
        }

        final DocumentEntity document = catalogService.create(ownerId, filename, sizeBytes, text);
        log.info("Ingesting {} ({} bytes, {} characters) as {}", filename, sizeBytes, text.length(), document.getId());

        final List<Chunk> chunks;
        try {
            chunks = indexingService.index(document);
        } catch (final UnsupportedFormatException e) {
            log.warn("Document {} has no indexable content, removing it", document.getId());
            catalogService.delete(document.getId());
            throw e;
        } catch (final RuntimeException e) {
            log.error("Indexing failed for document {}", document.getId(), e);
            catalogService.updateStatus(document.getId(), EDocumentStatus.FAILED);
            throw e;
        }

        catalogService.updateChunksAndStatus(document.getId(), chunks.size(), EDocumentStatus.INDEXED);
        metricsSink.recordDocumentAction(ownerId, document.getId(), EDocumentAction.UPLOAD);

        return new UploadResult(document.getId(), filename, EDocumentStatus.INDEXED,
                "Document processed successfully", chunks.size());
    }

    /**
     * Lists the documents of an owner.
     */
    public List<DocumentEntity> listDocuments(final String ownerId) {
        requireOwner(ownerId);
        return catalogService.listByOwner(ownerId);
    }

    /**
     * Returns the text of a document, reconstructed from the index when it has entries and read
     * from the catalog otherwise.
     */
    public String getContent(final String ownerId, final String documentId) throws IOException {
        requireOwner(ownerId);
        final DocumentEntity document = catalogService.getOwned(documentId, ownerId);

        final String indexed = vectorIndexService.getContent(documentId);
        metricsSink.recordDocumentAction(ownerId, documentId, EDocumentAction.VIEW);
        if (!indexed.isEmpty()) {
            return indexed;
        }
        return document.getContent() == null ? "" : document.getContent();
    }

    /**
     * Deletes a document and all associated index entries.
     */
    public void deleteDocument(final String ownerId, final String documentId) throws IOException {
        requireOwner(ownerId);
        catalogService.getOwned(documentId, ownerId);

        // 1. Delete from vector index
        vectorIndexService.delete(documentId);

        // 2. Delete DB record
        catalogService.delete(documentId);

        metricsSink.recordDocumentAction(ownerId, documentId, EDocumentAction.DELETE);
        log.info("Deleted document {} from catalog and index", documentId);
    }

    private static void requireOwner(final String ownerId) {
        if (StringUtils.isBlank(ownerId)) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
    }
}
