package eu.virtualparadox.documind.rag.retriever.service;

import eu.virtualparadox.documind.rag.retriever.model.SearchResult;

import java.util.List;

public interface RetrieverService {

    /**
     * Finds the chunks most similar to {@code query}.
     *
     * @param query      user question
     * @param k          maximum number of results
     * @param documentId restrict to one document, or {@code null}
     * @param ownerId    restrict to one owner's documents, or {@code null}
     * @return results ordered by descending similarity; empty when nothing matches or the
     *         query cannot be embedded
     */
    List<SearchResult> retrieve(final String query, final int k, final String documentId, final String ownerId);

}
