package eu.virtualparadox.documind.query.question;

import eu.virtualparadox.documind.query.model.QueryRequest;
import eu.virtualparadox.documind.query.model.QueryResult;

import java.time.Instant;
import java.util.concurrent.Future;

public class QuestionJob {
    private final long id;
    private final String ownerId;
    private final QueryRequest request;
    private volatile EQuestionStatus status;
    private volatile QueryResult result;
    private volatile String error;
    private volatile Future<?> future;
    private final Instant createdAt;
    private volatile Instant finishedAt;

    public QuestionJob(long id, String ownerId, QueryRequest request) {
        this.id = id;
        this.ownerId = ownerId;
        this.request = request;
        this.status = EQuestionStatus.QUEUED;
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public String getOwnerId() { return ownerId; }
    public QueryRequest getRequest() { return request; }
    public String getQuery() { return request.query(); }
    public EQuestionStatus getStatus() { return status; }
    public QueryResult getResult() { return result; }
    public String getError() { return error; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getFinishedAt() { return finishedAt; }

    Future<?> getFuture() { return future; }

    void setStatus(EQuestionStatus status) { this.status = status; }
    void setResult(QueryResult result) { this.result = result; }
    void setError(String error) { this.error = error; }
    void setFuture(Future<?> future) { this.future = future; }
    void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
