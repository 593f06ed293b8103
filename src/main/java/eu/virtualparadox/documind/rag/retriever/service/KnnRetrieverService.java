package eu.virtualparadox.documind.rag.retriever.service;

import eu.virtualparadox.documind.rag.embed.EmbeddingProvider;
import eu.virtualparadox.documind.rag.embed.EmbeddingUnavailableException;
import eu.virtualparadox.documind.rag.index.MetadataFilter;
import eu.virtualparadox.documind.rag.index.VectorIndexService;
import eu.virtualparadox.documind.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Provides semantic query capabilities over the vector index.
 * <p>
 * Steps:
 * <ol>
 *   <li>Embed the user query using {@link EmbeddingProvider}</li>
 *   <li>Compose the document and owner restrictions into one {@link MetadataFilter}</li>
 *   <li>Run the oversampled, filtered search of {@link VectorIndexService}</li>
 * </ol>
 * An embedding or index failure yields an empty result; the caller reports it as "nothing found".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class KnnRetrieverService implements RetrieverService {

    private final EmbeddingProvider embeddingProvider;
    private final VectorIndexService vectorIndexService;

    @Override
    public List<SearchResult> retrieve(final String query,
                                       final int k,
                                       final String documentId,
                                       final String ownerId) {
        if (query == null || query.isBlank() || k <= 0) {
            return List.of();
        }

        final float[] vector;
        try {
            vector = embeddingProvider.embed(query);
        } catch (final EmbeddingUnavailableException e) {
            log.warn("Query embedding unavailable, returning no results: {}", e.getMessage());
            return List.of();
        }

        try {
            final List<SearchResult> results = vectorIndexService.search(vector, k, MetadataFilter.of(documentId, ownerId));
            log.debug("Retrieved {} chunks for query '{}' (document={}, owner={})", results.size(), query, documentId, ownerId);
            return results;
        } catch (final IOException | RuntimeException e) {
            log.error("Vector search failed for query: {}", query, e);
            return List.of();
        }
    }
}
