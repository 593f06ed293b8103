package eu.virtualparadox.documind.api;

import eu.virtualparadox.documind.catalog.DocumentAccessDeniedException;
import eu.virtualparadox.documind.catalog.DocumentNotFoundException;
import eu.virtualparadox.documind.catalog.EDocumentStatus;
import eu.virtualparadox.documind.catalog.entity.DocumentEntity;
import eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException;
import eu.virtualparadox.documind.ingest.lifecycle.DocumentLifecycleManager;
import eu.virtualparadox.documind.ingest.model.UploadResult;
import eu.virtualparadox.documind.rag.embed.EmbeddingUnavailableException;
import eu.virtualparadox.documind.summary.SummaryService;
import eu.virtualparadox.documind.summary.model.ContentAnalysis;
import eu.virtualparadox.documind.summary.model.DocumentStatistics;
import eu.virtualparadox.documind.summary.model.DocumentSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class DocumentControllerTest {

    private final DocumentLifecycleManager lifecycleManager = mock(DocumentLifecycleManager.class);
    private final SummaryService summaryService = mock(SummaryService.class);

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new DocumentController(lifecycleManager, summaryService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static MockMultipartFile file(String name, String content) {
        return new MockMultipartFile("file", name, "text/plain", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Upload returns the indexed document")
    void upload() throws Exception {
        when(lifecycleManager.upload(eq("alice"), eq("notes.txt"), eq(5L), any()))
                .thenReturn(new UploadResult("d1", "notes.txt", EDocumentStatus.INDEXED, "Document processed successfully", 1));

        mvc.perform(multipart("/api/documents").file(file("notes.txt", "hello")).header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value("d1"))
                .andExpect(jsonPath("$.status").value("INDEXED"))
                .andExpect(jsonPath("$.chunks").value(1));
    }

    @Test
    @DisplayName("Unknown formats map to 415, files without text to 422")
    void unsupportedFormats() throws Exception {
        when(lifecycleManager.upload(eq("alice"), eq("virus.exe"), anyLong(), any()))
                .thenThrow(new UnsupportedFormatException(UnsupportedFormatException.EReason.UNKNOWN_FORMAT, "Unsupported file format: .exe"));
        when(lifecycleManager.upload(eq("alice"), eq("blank.txt"), anyLong(), any()))
                .thenThrow(new UnsupportedFormatException(UnsupportedFormatException.EReason.NO_USABLE_TEXT, "No text"));

        mvc.perform(multipart("/api/documents").file(file("virus.exe", "MZ")).header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error.code").value("UNKNOWN_FORMAT"))
                .andExpect(jsonPath("$.error.message").value("Unsupported file format: .exe"));

        mvc.perform(multipart("/api/documents").file(file("blank.txt", " ")).header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("NO_USABLE_TEXT"));
    }

    @Test
    @DisplayName("Empty uploads and missing owner headers are bad requests")
    void badRequests() throws Exception {
        mvc.perform(multipart("/api/documents").file(file("empty.txt", "")).header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));

        mvc.perform(get("/api/documents"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleManager);
    }

    @Test
    @DisplayName("Blank owner headers are rejected for upload and listing")
    void blankOwner() throws Exception {
        mvc.perform(multipart("/api/documents").file(file("notes.txt", "hello")).header(ApiHeaders.OWNER_ID, ""))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/documents").header(ApiHeaders.OWNER_ID, " "))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleManager);
    }

    @Test
    @DisplayName("An unavailable embedder maps to 503")
    void embeddingUnavailable() throws Exception {
        when(lifecycleManager.upload(eq("alice"), eq("notes.txt"), anyLong(), any()))
                .thenThrow(new EmbeddingUnavailableException("model not loaded"));

        mvc.perform(multipart("/api/documents").file(file("notes.txt", "hello")).header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("EMBEDDING_UNAVAILABLE"));
    }

    @Test
    @DisplayName("Listing returns the owner's documents")
    void list() throws Exception {
        when(lifecycleManager.listDocuments("alice")).thenReturn(List.of(DocumentEntity.builder()
                .id("d1").ownerId("alice").filename("notes.txt").fileType(".txt").sizeBytes(5)
                .uploadedAt(Instant.EPOCH).chunks(1).status(EDocumentStatus.INDEXED).build()));

        mvc.perform(get("/api/documents").header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("d1"))
                .andExpect(jsonPath("$[0].filename").value("notes.txt"))
                .andExpect(jsonPath("$[0].content").doesNotExist());
    }

    @Test
    @DisplayName("Content of missing and foreign documents maps to 404 and 403")
    void contentErrors() throws Exception {
        when(lifecycleManager.getContent("alice", "d1")).thenReturn("full text");
        when(lifecycleManager.getContent("alice", "missing")).thenThrow(new DocumentNotFoundException("missing"));
        when(lifecycleManager.getContent("alice", "foreign")).thenThrow(new DocumentAccessDeniedException("foreign"));

        mvc.perform(get("/api/documents/d1/content").header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value("d1"))
                .andExpect(jsonPath("$.content").value("full text"));
        mvc.perform(get("/api/documents/missing/content").header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("DOCUMENT_NOT_FOUND"));
        mvc.perform(get("/api/documents/foreign/content").header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("ACCESS_DENIED"));
    }

    @Test
    @DisplayName("A summary is generated for the owner's document")
    void summary() throws Exception {
        DocumentSummary summary = new DocumentSummary("s1", "d1", "report.pdf", ".pdf", 2048,
                Instant.EPOCH, Instant.EPOCH, "A report on solar output.", true,
                List.of("The key finding is a 12% gain"),
                new DocumentStatistics(120, 700, 9, 2048, 15.0, 0, 0, 3),
                new ContentAnalysis("Report/Analysis", "English", List.of("General Content"), List.of("Numerical Data")),
                "This PDF document contains approximately 120 words of detailed information.");
        when(summaryService.summarize("alice", "d1")).thenReturn(summary);
        when(summaryService.summarize("alice", "missing")).thenThrow(new DocumentNotFoundException("missing"));

        mvc.perform(post("/api/documents/d1/summary").header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executiveSummary").value("A report on solar output."))
                .andExpect(jsonPath("$.aiGenerated").value(true))
                .andExpect(jsonPath("$.statistics.wordCount").value(120))
                .andExpect(jsonPath("$.contentAnalysis.documentType").value("Report/Analysis"));
        mvc.perform(post("/api/documents/missing/summary").header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Delete answers 204")
    void delete() throws Exception {
        mvc.perform(org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete("/api/documents/d1")
                        .header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isNoContent());

        verify(lifecycleManager).deleteDocument("alice", "d1");
    }
}
