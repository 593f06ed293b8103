package eu.virtualparadox.documind.api;

import eu.virtualparadox.documind.api.model.DocumentContent;
import eu.virtualparadox.documind.api.model.DocumentView;
import eu.virtualparadox.documind.ingest.lifecycle.DocumentLifecycleManager;
import eu.virtualparadox.documind.ingest.model.UploadResult;
import eu.virtualparadox.documind.summary.SummaryService;
import eu.virtualparadox.documind.summary.model.DocumentSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Upload, listing, content, summaries and deletion of the caller's documents.
 *
 * <pre>
 * curl -X POST http://localhost:8080/api/documents -H "X-Owner-Id: alice" -F file=@report.pdf
 * curl http://localhost:8080/api/documents -H "X-Owner-Id: alice"
 * curl -X POST http://localhost:8080/api/documents/{id}/summary -H "X-Owner-Id: alice"
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentLifecycleManager lifecycleManager;
    private final SummaryService summaryService;

    @PostMapping(consumes = "multipart/form-data")
    public ResponseEntity<UploadResult> upload(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                                               @RequestParam("file") MultipartFile file) throws IOException {
        ApiHeaders.requireOwner(ownerId);
        if (file.isEmpty() || file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()) {
            throw new IllegalArgumentException("A non-empty file with a name is required");
        }

        log.info("Upload request from {}: {} ({} bytes)", ownerId, file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            return ResponseEntity.ok(lifecycleManager.upload(ownerId, file.getOriginalFilename(), file.getSize(), in));
        }
    }

    @GetMapping
    public List<DocumentView> list(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId) {
        return lifecycleManager.listDocuments(ApiHeaders.requireOwner(ownerId)).stream()
                .map(DocumentView::from)
                .toList();
    }

    @GetMapping("/{id}/content")
    public DocumentContent content(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                                   @PathVariable("id") String id) throws IOException {
        return new DocumentContent(id, lifecycleManager.getContent(ApiHeaders.requireOwner(ownerId), id));
    }

    @PostMapping("/{id}/summary")
    public DocumentSummary summarize(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                                     @PathVariable("id") String id) {
        return summaryService.summarize(ApiHeaders.requireOwner(ownerId), id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                                       @PathVariable("id") String id) throws IOException {
        lifecycleManager.deleteDocument(ApiHeaders.requireOwner(ownerId), id);
        return ResponseEntity.noContent().build();
    }
}
