package eu.virtualparadox.documind.rag.index;

import eu.virtualparadox.documind.rag.retriever.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static eu.virtualparadox.documind.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService} using the HNSW k-NN graph.
 * <p>
 * Chunk text, metadata and dense vectors are written into a single Lucene index:
 * <ul>
 *   <li>Each chunk is stored as one Lucene {@link Document}</li>
 *   <li>Text content is stored for answer synthesis and content reconstruction</li>
 *   <li>Vectors are written via {@link KnnFloatVectorField} to enable fast ANN search</li>
 * </ul>
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code docId}, {@code chunkId}, {@code ownerId}, {@code fileType} - {@link StringField}, stored</li>
 *   <li>{@code text} - {@link TextField}, stored</li>
 *   <li>{@code filename}, {@code chunkIndex}, {@code uploadedAt} - {@link StoredField} only</li>
 *   <li>{@code vector} - {@link KnnFloatVectorField} with {@link VectorSimilarityFunction#DOT_PRODUCT}</li>
 * </ul>
 *
 * <p><b>Similarity:</b> vectors are L2-normalised before they are written or searched, so the dot
 * product equals the cosine. Lucene reports {@code (1 + dot) / 2}; this service converts it back
 * to the cosine in {@code [-1, 1]}. A zero vector stays zero and scores 0 against everything.</p>
 */
@Slf4j
@Service
public final class LuceneVectorIndexService implements VectorIndexService {

    private static final int MAX_CANDIDATES = 50;
    private static final int OVERSAMPLING = 4;
    private static final String CONTENT_SEPARATOR = "\n\n";

    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final int dimension;
    private final double minSimilarity;

    public LuceneVectorIndexService(final IndexWriter writer,
                                    final SearcherManager searcherManager,
                                    @Value("${documind.embedding.dimension:384}") final int dimension,
                                    @Value("${documind.retrieval.min-similarity:-1.0}") final double minSimilarity) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        this.writer = writer;
        this.searcherManager = searcherManager;
        this.dimension = dimension;
        this.minSimilarity = minSimilarity;
    }

    @Override
    public void add(final IndexEntry entry) throws IOException {
        requireValid(entry);

        writer.updateDocument(new Term(FIELD_CHUNK_ID, entry.chunkId()), buildLuceneDocument(entry));
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    /**
     * Replaces all entries of a document.
     * <p>
     * The operation is implemented as:
     * <ol>
     *   <li>Validate every entry (dimension, ownership) before touching the index</li>
     *   <li>Atomically delete the old block and add the new one with {@link IndexWriter#updateDocuments}</li>
     *   <li>Commit and refresh the searcher so the whole block becomes visible at once</li>
     * </ol>
     */
    @Override
    public void addAll(final String docId, final List<IndexEntry> entries) throws IOException {
        requireNonNullOrEmpty(docId, "docId");
        requireNonNullOrEmpty(entries, "entries");

        final List<Document> documents = new ArrayList<>(entries.size());
        for (final IndexEntry entry : entries) {
            requireValid(entry);
            if (!docId.equals(entry.metadata().docId())) {
                throw new IllegalArgumentException("Entry " + entry.chunkId() + " does not belong to document " + docId);
            }
            documents.add(buildLuceneDocument(entry));
        }

        writer.updateDocuments(new Term(FIELD_DOC_ID, docId), documents);
        writer.commit();
        searcherManager.maybeRefreshBlocking();

        log.info("Indexed {} chunks for document {}", documents.size(), docId);
    }

    @Override
    public List<SearchResult> search(final float[] queryVector,
                                     final int k,
                                     final MetadataFilter filter) throws IOException {
        if (k <= 0) {
            return List.of();
        }
        if (queryVector == null) {
            throw new IllegalArgumentException("queryVector must not be null");
        }
        ensureDimension(queryVector);

        final MetadataFilter predicate = filter == null ? MetadataFilter.ALL : filter;
        final int candidates = Math.min(OVERSAMPLING * k, MAX_CANDIDATES);

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, normalizedCopy(queryVector), candidates);
            final TopDocs topDocs = searcher.search(knn, candidates);
            final StoredFields storedFields = searcher.storedFields();

            final List<SearchResult> results = new ArrayList<>();
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final Document doc = storedFields.document(sd.doc);
                final ChunkMetadata metadata = toMetadata(doc);
                if (!predicate.test(metadata)) {
                    continue;
                }

                final float similarity = toCosine(sd.score);
                if (similarity <= minSimilarity) {
                    continue;
                }

                results.add(new SearchResult(doc.get(FIELD_CHUNK_ID), doc.get(FIELD_TEXT), metadata, similarity));
                if (results.size() == k) {
                    break;
                }
            }

            log.debug("Vector search: {} candidates, {} after filtering (k={})",
                    topDocs.scoreDocs.length, results.size(), k);
            return results;
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public void delete(final String docId) throws IOException {
        requireNonNullOrEmpty(docId, "docId");
        writer.deleteDocuments(new Term(FIELD_DOC_ID, docId));
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    @Override
    public String getContent(final String docId) throws IOException {
        requireNonNullOrEmpty(docId, "docId");

        final List<Document> documents = collect(new TermQuery(new Term(FIELD_DOC_ID, docId)));
        return documents.stream()
                .sorted(Comparator.comparingInt(d -> d.getField(FIELD_CHUNK_INDEX).numericValue().intValue()))
                .map(d -> d.get(FIELD_TEXT))
                .collect(Collectors.joining(CONTENT_SEPARATOR));
    }

    @Override
    public List<IndexedDocument> listDocuments() throws IOException {
        final Map<String, List<ChunkMetadata>> byDocument = new LinkedHashMap<>();
        for (final Document doc : collect(new MatchAllDocsQuery())) {
            final ChunkMetadata metadata = toMetadata(doc);
            byDocument.computeIfAbsent(metadata.docId(), id -> new ArrayList<>()).add(metadata);
        }

        return byDocument.entrySet().stream()
                .map(e -> {
                    final ChunkMetadata first = e.getValue().get(0);
                    return new IndexedDocument(e.getKey(), first.ownerId(), first.filename(),
                            first.fileType(), first.uploadedAt(), e.getValue().size());
                })
                .sorted(Comparator.comparing(IndexedDocument::uploadedAt).reversed())
                .toList();
    }

    @Override
    public int count() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    /**
     * Loads the stored fields of every live document matching {@code query}.
     */
    private List<Document> collect(final Query query) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int hits = searcher.count(query);
            if (hits == 0) {
                return List.of();
            }

            final TopDocs topDocs = searcher.search(query, hits);
            final StoredFields storedFields = searcher.storedFields();
            final List<Document> documents = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                documents.add(storedFields.document(sd.doc));
            }
            return documents;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Builds a Lucene {@link Document} for a single entry.
     *
     * @param entry chunk text, vector and metadata
     * @return a fully populated Lucene document
     */
    private Document buildLuceneDocument(final IndexEntry entry) {
        final ChunkMetadata m = entry.metadata();
        final Document d = new Document();

        // Identifiers and filter fields
        d.add(new StringField(FIELD_DOC_ID, m.docId(), Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_ID, entry.chunkId(), Field.Store.YES));
        d.add(new StringField(FIELD_OWNER_ID, nullToEmpty(m.ownerId()), Field.Store.YES));
        d.add(new StringField(FIELD_FILE_TYPE, nullToEmpty(m.fileType()), Field.Store.YES));

        // Text content (indexed + stored for retrieval)
        d.add(new TextField(FIELD_TEXT, entry.text(), Field.Store.YES));

        // Display metadata (stored only)
        d.add(new StoredField(FIELD_FILENAME, nullToEmpty(m.filename())));
        d.add(new StoredField(FIELD_CHUNK_INDEX, m.chunkIndex()));
        d.add(new StoredField(FIELD_UPLOADED_AT, m.uploadedAt() == null ? 0L : m.uploadedAt().toEpochMilli()));

        // Vector for HNSW ANN search
        d.add(new KnnFloatVectorField(FIELD_VECTOR, normalizedCopy(entry.vector()), VectorSimilarityFunction.DOT_PRODUCT));

        return d;
    }

    private ChunkMetadata toMetadata(final Document doc) {
        return new ChunkMetadata(
                doc.get(FIELD_DOC_ID),
                doc.get(FIELD_OWNER_ID),
                doc.getField(FIELD_CHUNK_INDEX).numericValue().intValue(),
                doc.get(FIELD_FILENAME),
                doc.get(FIELD_FILE_TYPE),
                Instant.ofEpochMilli(doc.getField(FIELD_UPLOADED_AT).numericValue().longValue()));
    }

    private void requireValid(final IndexEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry must not be null");
        }
        requireNonNullOrEmpty(entry.chunkId(), "chunkId");
        if (entry.text() == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        if (entry.metadata() == null) {
            throw new IllegalArgumentException("metadata must not be null");
        }
        requireNonNullOrEmpty(entry.metadata().docId(), "metadata.docId");
        if (entry.vector() == null) {
            throw new IllegalArgumentException("vector must not be null");
        }
        ensureDimension(entry.vector());
    }

    private void ensureDimension(final float[] vector) {
        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
    }

    /**
     * Maps Lucene's dot-product score {@code (1 + dot) / 2} back to the cosine.
     */
    private static float toCosine(final float luceneScore) {
        return 2f * luceneScore - 1f;
    }

    /**
     * Returns a unit-length copy of {@code vector}; the zero vector is returned as zeros.
     */
    private static float[] normalizedCopy(final float[] vector) {
        final float[] copy = vector.clone();
        double norm = 0.0;
        for (final float v : copy) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < copy.length; i++) {
                copy[i] /= (float) norm;
            }
        }
        return copy;
    }

    private static String nullToEmpty(final String value) {
        return value == null ? "" : value;
    }

    /**
     * Utility to assert a required string or collection is non-null/non-empty.
     *
     * @param value value to check
     * @param name  parameter name for error messaging
     */
    private void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }

        if (value instanceof List<?> list && list.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
