package eu.virtualparadox.documind.rag.index;

import eu.virtualparadox.documind.application.config.ApplicationConfig;
import eu.virtualparadox.documind.application.executor.EmbeddingExecutor;
import eu.virtualparadox.documind.catalog.entity.DocumentEntity;
import eu.virtualparadox.documind.ingest.chunker.Chunker;
import eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException;
import eu.virtualparadox.documind.ingest.model.Chunk;
import eu.virtualparadox.documind.rag.embed.EmbeddingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException.EReason.NO_USABLE_TEXT;

/**
 * Orchestrates the indexing pipeline for one document:
 * <ol>
 *     <li>Chunk the extracted text</li>
 *     <li>Embed every chunk, concurrently on the bounded {@link EmbeddingExecutor}</li>
 *     <li>Replace the document's entries in the vector index in one block</li>
 * </ol>
 * <p>
 * The index is only touched once every chunk has a vector, either a real one or, when
 * {@code documind.ingest.zero-vector-fallback} is enabled, the zero vector.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexingService {

    private final Chunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndexService vectorIndexService;
    private final EmbeddingExecutor embeddingExecutor;
    private final ApplicationConfig config;

    /**
     * Indexes the content of a catalog document.
     *
     * @param document the catalog entity whose {@code content} is indexed
     * @return the chunks written to the index
     * @throws UnsupportedFormatException if no chunk survives noise suppression
     * @throws eu.virtualparadox.documind.rag.embed.EmbeddingUnavailableException if embedding fails
     *         and the zero-vector fallback is disabled
     * @throws DimensionMismatchException if the embedder produced vectors of the wrong length
     */
    public List<Chunk> index(final DocumentEntity document) {
        final List<Chunk> chunks = chunker.chunk(document.getId(), document.getContent() == null ? "" : document.getContent());
        if (chunks.isEmpty() || (chunks.size() == 1 && chunks.get(0).text().isEmpty())) {
            throw new UnsupportedFormatException(NO_USABLE_TEXT, "Document " + document.getFilename() + " produced no indexable chunks");
        }

        final List<float[]> vectors = embedAll(chunks);

        final List<IndexEntry> entries = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            final Chunk chunk = chunks.get(i);
            final ChunkMetadata metadata = new ChunkMetadata(
                    document.getId(),
                    document.getOwnerId(),
                    chunk.index(),
                    document.getFilename(),
                    document.getFileType(),
                    document.getUploadedAt());
            entries.add(new IndexEntry(chunk.chunkId(), chunk.text(), vectors.get(i), metadata));
        }

        try {
            vectorIndexService.addAll(document.getId(), entries);
        } catch (final IOException e) {
            throw new IllegalStateException("Indexing failed for document: " + document.getId(), e);
        }

        log.info("Document {} ({}) indexed as {} chunks", document.getId(), document.getFilename(), chunks.size());
        return chunks;
    }

    /**
     * Embeds each chunk as an independent task and waits for all of them, preserving chunk order.
     */
    private List<float[]> embedAll(final List<Chunk> chunks) {
        final boolean fallback = config.getIngest().isZeroVectorFallback();

        final List<CompletableFuture<float[]>> futures = new ArrayList<>(chunks.size());
        for (final Chunk chunk : chunks) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> fallback ? embeddingProvider.embedOrZero(chunk.text()) : embeddingProvider.embed(chunk.text()),
                    embeddingExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (final CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        return futures.stream().map(CompletableFuture::join).toList();
    }
}
