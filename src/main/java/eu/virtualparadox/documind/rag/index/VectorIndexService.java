package eu.virtualparadox.documind.rag.index;

import eu.virtualparadox.documind.rag.retriever.model.SearchResult;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over the vector index used for approximate nearest neighbor (ANN) search.
 * <p>
 * Implementations persist chunk-level vectors alongside the chunk text and its filterable
 * metadata, and provide the lifecycle operations required by the ingestion pipeline:
 * <ul>
 *   <li><b>Add</b> - upsert one entry, or replace all entries of a document in one block</li>
 *   <li><b>Search</b> - similarity ranking with metadata filtering</li>
 *   <li><b>Delete</b> - remove all entries belonging to a document</li>
 * </ul>
 * <p>
 * All vectors share the dimension reported by {@link #dimension()} for the lifetime of the index.
 */
public interface VectorIndexService {

    /**
     * Adds or replaces a single entry, keyed by its chunk id.
     *
     * @param entry the entry to store
     * @throws IOException                if writing to the underlying index fails
     * @throws DimensionMismatchException if the vector length differs from {@link #dimension()}
     */
    void add(final IndexEntry entry) throws IOException;

    /**
     * Replaces every entry of a document with the given entries.
     * <p>
     * Searches observe either none or all of the new entries: existing entries of
     * {@code docId} are deleted and the new ones written as one block, then made visible together.
     *
     * @param docId   the parent document identifier (non-null, non-blank)
     * @param entries entries belonging to {@code docId} (non-null, non-empty)
     * @throws IOException                if writing to the underlying index fails
     * @throws DimensionMismatchException if any vector has the wrong length; nothing is written then
     */
    void addAll(final String docId, final List<IndexEntry> entries) throws IOException;

    /**
     * Ranks indexed entries by cosine similarity to {@code queryVector}.
     * <p>
     * Over-fetches {@code min(4k, 50)} nearest candidates, keeps those accepted by {@code filter}
     * in similarity order and truncates to {@code k}.
     *
     * @param queryVector query embedding
     * @param k           maximum number of results; {@code k <= 0} yields an empty list
     * @param filter      metadata predicate, {@link MetadataFilter#ALL} for no filtering
     * @return results ordered by descending similarity (never null)
     * @throws IOException if the searcher cannot be acquired or executed
     */
    List<SearchResult> search(final float[] queryVector, final int k, final MetadataFilter filter) throws IOException;

    /**
     * Removes all entries belonging to the document. Deleting an unknown document is a no-op.
     *
     * @param docId the parent document identifier (non-null, non-blank)
     * @throws IOException if the underlying index update fails
     */
    void delete(final String docId) throws IOException;

    /**
     * Reconstructs a document's text from its chunks, ordered by chunk index and separated by a
     * blank line.
     *
     * @param docId the parent document identifier
     * @return the joined text, or an empty string when the document has no entries
     * @throws IOException if the searcher cannot be acquired or executed
     */
    String getContent(final String docId) throws IOException;

    /**
     * @return one summary per indexed document, most recently uploaded first
     * @throws IOException if the searcher cannot be acquired or executed
     */
    List<IndexedDocument> listDocuments() throws IOException;

    /**
     * @return the number of entries currently visible to search
     * @throws IOException if the searcher cannot be acquired
     */
    int count() throws IOException;

    /**
     * @return the vector dimension every entry must have
     */
    int dimension();
}
