package eu.virtualparadox.documind.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates and manages the Lucene resources backing the vector index.
 * <p>The index lives under {@code documind.index}; writer and searcher manager are closed on shutdown.
 * The writer is opened once per process, so a second instance against the same folder fails fast
 * on Lucene's write lock.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private Analyzer analyzer;

    @Bean
    public Directory luceneDirectory(final ApplicationConfig config) throws IOException {
        final Path indexPath = config.getIndex();
        if (indexPath == null) {
            throw new IllegalStateException("documind.index must be configured");
        }
        Files.createDirectories(indexPath);
        this.directory = FSDirectory.open(indexPath);
        log.info("Opened vector index directory {}", indexPath);
        return this.directory;
    }

    /**
     * Analyzer for the stored chunk text field.
     */
    @Bean
    public Analyzer analyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    @Bean
    public IndexWriter indexWriter(final Directory dir, final Analyzer analyzer) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.indexWriter = new IndexWriter(dir, cfg);
        log.info("Vector index holds {} chunk entries", indexWriter.getDocStats().numDocs);
        return this.indexWriter;
    }

    /**
     * Searchers are refreshed explicitly after each commit, never in the background, so a
     * document's chunks become visible together.
     */
    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    @PreDestroy
    public void close() {
        try { if (searcherManager != null) searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager", e);
        }

        try { if (indexWriter != null) indexWriter.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter", e);
        }

        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }

        try { if (directory != null) directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory", e);
        }
    }
}
