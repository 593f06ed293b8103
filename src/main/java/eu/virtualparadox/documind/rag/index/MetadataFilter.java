package eu.virtualparadox.documind.rag.index;

import java.util.Objects;

/**
 * Predicate over {@link ChunkMetadata} applied to search candidates.
 */
@FunctionalInterface
public interface MetadataFilter {

    MetadataFilter ALL = metadata -> true;

    boolean test(ChunkMetadata metadata);

    default MetadataFilter and(final MetadataFilter other) {
        Objects.requireNonNull(other, "other must not be null");
        return metadata -> test(metadata) && other.test(metadata);
    }

    static MetadataFilter byDocument(final String docId) {
        return metadata -> docId.equals(metadata.docId());
    }

    static MetadataFilter byOwner(final String ownerId) {
        return metadata -> ownerId.equals(metadata.ownerId());
    }

    /**
     * Conjunction of the document and owner predicates; a {@code null} or blank argument
     * leaves that dimension unconstrained.
     */
    static MetadataFilter of(final String docId, final String ownerId) {
        MetadataFilter filter = ALL;
        if (docId != null && !docId.isBlank()) {
            filter = filter.and(byDocument(docId));
        }
        if (ownerId != null && !ownerId.isBlank()) {
            filter = filter.and(byOwner(ownerId));
        }
        return filter;
    }
}
