package eu.virtualparadox.documind.catalog.service;

import eu.virtualparadox.documind.catalog.DocumentAccessDeniedException;
import eu.virtualparadox.documind.catalog.DocumentNotFoundException;
import eu.virtualparadox.documind.catalog.EDocumentStatus;
import eu.virtualparadox.documind.catalog.entity.DocumentEntity;
import eu.virtualparadox.documind.catalog.repo.DocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Service layer responsible for managing the document catalog.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Persisting document metadata and the full extracted text in the relational catalog (H2)</li>
 *     <li>Providing owner-scoped access to catalog records for listing, lookup, and deletion</li>
 *     <li>Tracking the ingestion status and chunk count of each document</li>
 * </ul>
 *
 * <p>Vector indexing (Lucene HNSW) is handled separately, with the document id acting as the link.</p>
 */
@Service
@RequiredArgsConstructor
public class DocumentCatalogService {

    private final DocumentRepository repository;

    /**
     * Registers a newly uploaded document in {@link EDocumentStatus#PROCESSING} state.
     *
     * @param ownerId  identifier of the uploading user
     * @param filename original filename provided by the user
     * @param sizeBytes size of the uploaded file
     * @param content  extracted, cleaned document text
     * @return the persisted {@link DocumentEntity}
     */
    @Transactional
    public DocumentEntity create(final String ownerId,
                                 final String filename,
                                 final long sizeBytes,
                                 final String content) {
        final DocumentEntity entity = DocumentEntity.builder()
                .id(generateId())
                .ownerId(ownerId)
                .filename(filename)
                .fileType(fileExtension(filename))
                .sizeBytes(sizeBytes)
                .uploadedAt(Instant.now())
                .content(content)
                .chunks(0)
                .status(EDocumentStatus.PROCESSING)
                .build();

        return repository.save(entity);
    }

    /**
     * Lists the documents of one owner, most recent first.
     */
    @Transactional(readOnly = true)
    public List<DocumentEntity> listByOwner(final String ownerId) {
        return repository.findByOwnerIdOrderByUploadedAtDesc(ownerId);
    }

    @Transactional(readOnly = true)
    public Optional<DocumentEntity> findById(final String id) {
        return repository.findById(id);
    }

    /**
     * Looks up a document on behalf of its owner.
     *
     * @throws DocumentNotFoundException     if no such document exists
     * @throws DocumentAccessDeniedException if the document belongs to another owner
     */
    @Transactional(readOnly = true)
    public DocumentEntity getOwned(final String id, final String ownerId) {
        final DocumentEntity doc = repository.findById(id)
                .orElseThrow(() -> new DocumentNotFoundException(id));
        if (!doc.getOwnerId().equals(ownerId)) {
            throw new DocumentAccessDeniedException(id);
        }
        return doc;
    }

    /**
     * Deletes a catalog record. Unknown ids are ignored.
     * <p>Note: vector index deletion should be performed separately.</p>
     */
    @Transactional
    public void delete(final String id) {
        if (repository.existsById(id)) {
            repository.deleteById(id);
        }
    }

    @Transactional
    public void updateStatus(final String id, final EDocumentStatus status) {
        repository.updateStatus(id, status);
    }

    @Transactional
    public void updateChunksAndStatus(final String id, final int chunks, final EDocumentStatus status) {
        repository.updateChunksAndStatus(id, chunks, status);
    }

    /**
     * Extracts the file extension from a filename.
     *
     * @param name original filename, may be null
     * @return the lower-case extension including the dot (e.g., ".pdf"), or an empty string if none found
     */
    public static String fileExtension(final String name) {
        if (name == null) {
            return "";
        }
        final int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return name.substring(dot).trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Generates a new unique identifier for a document: a UUID with dashes removed.
     */
    private String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
