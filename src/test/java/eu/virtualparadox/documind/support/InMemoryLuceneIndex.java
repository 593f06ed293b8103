package eu.virtualparadox.documind.support;

import eu.virtualparadox.documind.rag.index.LuceneVectorIndexService;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;

import java.io.IOException;

/**
 * A {@link LuceneVectorIndexService} over a heap-resident directory, closed after each test.
 */
public final class InMemoryLuceneIndex implements AutoCloseable {

    private final ByteBuffersDirectory directory;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final LuceneVectorIndexService service;

    public InMemoryLuceneIndex(int dimension) throws IOException {
        this(dimension, -1.0);
    }

    public InMemoryLuceneIndex(int dimension, double minSimilarity) throws IOException {
        this.directory = new ByteBuffersDirectory();
        this.writer = new IndexWriter(directory, new IndexWriterConfig(new StandardAnalyzer()));
        this.searcherManager = new SearcherManager(writer, null);
        this.service = new LuceneVectorIndexService(writer, searcherManager, dimension, minSimilarity);
    }

    public LuceneVectorIndexService service() {
        return service;
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }
}
