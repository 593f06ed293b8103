package eu.virtualparadox.documind.ingest.lifecycle;

import eu.virtualparadox.documind.application.config.ApplicationConfig;
import eu.virtualparadox.documind.application.executor.EmbeddingExecutor;
import eu.virtualparadox.documind.catalog.DocumentAccessDeniedException;
import eu.virtualparadox.documind.catalog.EDocumentStatus;
import eu.virtualparadox.documind.catalog.entity.DocumentEntity;
import eu.virtualparadox.documind.catalog.service.DocumentCatalogService;
import eu.virtualparadox.documind.ingest.chunker.Chunker;
import eu.virtualparadox.documind.ingest.cleaner.TextCleaner;
import eu.virtualparadox.documind.ingest.extractor.CsvTextExtractor;
import eu.virtualparadox.documind.ingest.extractor.PlainTextExtractor;
import eu.virtualparadox.documind.ingest.extractor.TextExtractorRegistry;
import eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException;
import eu.virtualparadox.documind.ingest.model.UploadResult;
import eu.virtualparadox.documind.metrics.InMemoryMetricsSink;
import eu.virtualparadox.documind.rag.embed.EmbeddingUnavailableException;
import eu.virtualparadox.documind.rag.index.DimensionMismatchException;
import eu.virtualparadox.documind.rag.index.IndexingService;
import eu.virtualparadox.documind.support.HashingEmbeddingProvider;
import eu.virtualparadox.documind.support.InMemoryLuceneIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DocumentLifecycleManagerTest {

    private static final int DIM = 64;
    private static final String DOC_ID = "doc1";

    private final ApplicationConfig config = new ApplicationConfig();
    private final HashingEmbeddingProvider embedder = new HashingEmbeddingProvider(DIM);
    private final DocumentCatalogService catalog = mock(DocumentCatalogService.class);
    private final InMemoryMetricsSink metricsSink = new InMemoryMetricsSink();
    private final TextExtractorRegistry registry =
            new TextExtractorRegistry(List.of(new PlainTextExtractor(), new CsvTextExtractor()));

    private InMemoryLuceneIndex index;
    private EmbeddingExecutor executor;
    private DocumentLifecycleManager manager;

    @BeforeEach
    void setUp() throws IOException {
        index = new InMemoryLuceneIndex(DIM);

        executor = new EmbeddingExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.initialize();

        IndexingService indexing = new IndexingService(new Chunker(500, 100), embedder, index.service(), executor, config);
        manager = manager(indexing);

        when(catalog.create(anyString(), anyString(), anyLong(), anyString())).thenAnswer(invocation -> DocumentEntity.builder()
                .id(DOC_ID)
                .ownerId(invocation.getArgument(0))
                .filename(invocation.getArgument(1))
                .fileType(DocumentCatalogService.fileExtension(invocation.getArgument(1)))
                .sizeBytes(invocation.getArgument(2))
                .content(invocation.getArgument(3))
                .uploadedAt(Instant.now())
                .status(EDocumentStatus.PROCESSING)
                .build());
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdown();
        index.close();
    }

    private DocumentLifecycleManager manager(IndexingService indexing) {
        return new DocumentLifecycleManager(catalog, registry, new TextCleaner(), indexing, index.service(), metricsSink);
    }

    private static InputStream utf8(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("An upload is cleaned, cataloged and indexed before the call returns")
    void uploadIndexes() throws IOException {
        String text = "Solar panels convert sunlight into electricity. They work best at noon.";

        UploadResult result = manager.upload("alice", "notes.txt", text.length(), utf8(text));

        assertEquals(DOC_ID, result.documentId());
        assertEquals("notes.txt", result.filename());
        assertEquals(EDocumentStatus.INDEXED, result.status());
        assertEquals(1, result.chunks());
        assertEquals("Document processed successfully", result.message());

        verify(catalog).create(eq("alice"), eq("notes.txt"), eq((long) text.length()),
                eq("Solar panels convert sunlight into electricity. They work best at noon."));
        verify(catalog).updateChunksAndStatus(DOC_ID, 1, EDocumentStatus.INDEXED);
        assertEquals(1, index.service().count());
        assertEquals(1, metricsSink.summarize("alice").totalDocumentAccesses());
    }

    @Test
    @DisplayName("Unsupported formats are rejected before anything is stored")
    void unknownFormat() {
        UnsupportedFormatException ex = assertThrows(UnsupportedFormatException.class,
                () -> manager.upload("alice", "virus.exe", 2, utf8("MZ")));

        assertEquals(UnsupportedFormatException.EReason.UNKNOWN_FORMAT, ex.getReason());
        verifyNoInteractions(catalog);
    }

    @Test
    @DisplayName("Files without text are rejected before anything is stored")
    void noText() {
        UnsupportedFormatException ex = assertThrows(UnsupportedFormatException.class,
                () -> manager.upload("alice", "blank.txt", 3, utf8("\u200B \n")));

        assertEquals(UnsupportedFormatException.EReason.NO_USABLE_TEXT, ex.getReason());
        verifyNoInteractions(catalog);
    }

    @Test
    @DisplayName("A document without indexable chunks leaves no catalog record")
    void noChunks() {
        IndexingService indexing = mock(IndexingService.class);
        when(indexing.index(any())).thenThrow(new UnsupportedFormatException(
                UnsupportedFormatException.EReason.NO_USABLE_TEXT, "no chunks"));

        assertThrows(UnsupportedFormatException.class,
                () -> manager(indexing).upload("alice", "short.txt", 5, utf8("hello")));

        verify(catalog).delete(DOC_ID);
        verify(catalog, never()).updateChunksAndStatus(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("An indexing failure marks the document as failed and is rethrown")
    void indexingFailure() throws IOException {
        config.getIngest().setZeroVectorFallback(false);
        embedder.setAvailable(false);

        assertThrows(EmbeddingUnavailableException.class,
                () -> manager.upload("alice", "notes.txt", 20, utf8("Solar panels and batteries.")));

        verify(catalog).updateStatus(DOC_ID, EDocumentStatus.FAILED);
        verify(catalog, never()).delete(anyString());
        assertEquals(0, index.service().count());
    }

    @Test
    @DisplayName("An embedder of the wrong dimension marks the document as failed")
    void dimensionMismatch() throws IOException {
        IndexingService mismatched = new IndexingService(new Chunker(500, 100),
                new HashingEmbeddingProvider(DIM * 2), index.service(), executor, config);

        assertThrows(DimensionMismatchException.class,
                () -> manager(mismatched).upload("alice", "notes.txt", 20, utf8("Solar panels and batteries.")));

        verify(catalog).updateStatus(DOC_ID, EDocumentStatus.FAILED);
        verify(catalog, never()).updateChunksAndStatus(anyString(), anyInt(), any());
        assertEquals(0, index.service().count());
    }

    @Test
    @DisplayName("A blank owner can neither upload nor list")
    void blankOwner() {
        assertThrows(IllegalArgumentException.class,
                () -> manager.upload(" ", "notes.txt", 5, utf8("hello")));
        assertThrows(IllegalArgumentException.class, () -> manager.listDocuments(""));
        assertThrows(IllegalArgumentException.class, () -> manager.getContent(null, DOC_ID));

        verifyNoInteractions(catalog);
    }

    @Test
    @DisplayName("Content is served from the index and falls back to the catalog")
    void content() throws IOException {
        String csv = "city,country\nParis,France\n";
        manager.upload("alice", "cities.csv", csv.length(), utf8(csv));
        DocumentEntity entity = DocumentEntity.builder().id(DOC_ID).ownerId("alice").content("catalog copy").build();
        when(catalog.getOwned(DOC_ID, "alice")).thenReturn(entity);

        assertEquals("city | country\nParis | France", manager.getContent("alice", DOC_ID));

        index.service().delete(DOC_ID);
        assertEquals("catalog copy", manager.getContent("alice", DOC_ID));
    }

    @Test
    @DisplayName("Foreign documents can neither be read nor deleted")
    void foreignDocument() throws IOException {
        manager.upload("alice", "notes.txt", 10, utf8("Private notes of alice."));
        when(catalog.getOwned(DOC_ID, "mallory")).thenThrow(new DocumentAccessDeniedException(DOC_ID));

        assertThrows(DocumentAccessDeniedException.class, () -> manager.getContent("mallory", DOC_ID));
        assertThrows(DocumentAccessDeniedException.class, () -> manager.deleteDocument("mallory", DOC_ID));

        assertEquals(1, index.service().count());
        verify(catalog, never()).delete(anyString());
    }

    @Test
    @DisplayName("Deleting removes index entries and the catalog record")
    void delete() throws IOException {
        manager.upload("alice", "notes.txt", 10, utf8("Notes about solar panels."));
        when(catalog.getOwned(DOC_ID, "alice")).thenReturn(DocumentEntity.builder().id(DOC_ID).ownerId("alice").build());

        manager.deleteDocument("alice", DOC_ID);

        assertEquals(0, index.service().count());
        verify(catalog).delete(DOC_ID);
        assertThat(metricsSink.summarize("alice").documentUsage())
                .singleElement()
                .satisfies(usage -> assertEquals(2, usage.accessCount()));
    }
}
