package eu.virtualparadox.documind.api;

import eu.virtualparadox.documind.api.model.QueryJobView;
import eu.virtualparadox.documind.query.QueryManager;
import eu.virtualparadox.documind.query.model.QueryRequest;
import eu.virtualparadox.documind.query.model.QueryResult;
import eu.virtualparadox.documind.query.question.QuestionJob;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Question answering over the caller's documents, synchronously or as a job.
 *
 * <pre>
 * curl -X POST http://localhost:8080/api/query -H "X-Owner-Id: alice" \
 *   -H "Content-Type: application/json" -d '{"query": "What is the capital of France?"}'
 * </pre>
 */
@RestController
@RequestMapping("/api/query")
@RequiredArgsConstructor
public class QueryController {

    private final QueryManager queryManager;

    @PostMapping
    public QueryResult query(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                             @RequestBody QueryRequest request) {
        return queryManager.answer(ApiHeaders.requireOwner(ownerId), request);
    }

    @PostMapping("/jobs")
    public ResponseEntity<QueryJobView> submit(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                                               @RequestBody QueryRequest request) {
        final QuestionJob job = queryManager.submitQuery(ApiHeaders.requireOwner(ownerId), request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(QueryJobView.from(job));
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<QueryJobView> job(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                                            @PathVariable("id") long id) {
        ApiHeaders.requireOwner(ownerId);
        return queryManager.getJob(id)
                .filter(job -> job.getOwnerId().equals(ownerId))
                .map(job -> ResponseEntity.ok(QueryJobView.from(job)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<QueryJobView> cancel(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                                               @PathVariable("id") long id) {
        ApiHeaders.requireOwner(ownerId);
        final var job = queryManager.getJob(id).filter(j -> j.getOwnerId().equals(ownerId));
        if (job.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        queryManager.cancel(id);
        return ResponseEntity.ok(QueryJobView.from(job.get()));
    }
}
