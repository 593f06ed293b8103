package eu.virtualparadox.documind.api.model;

import eu.virtualparadox.documind.query.model.QueryResult;
import eu.virtualparadox.documind.query.question.EQuestionStatus;
import eu.virtualparadox.documind.query.question.QuestionJob;

import java.time.Instant;

public record QueryJobView(long id,
                           String query,
                           EQuestionStatus status,
                           Instant createdAt,
                           QueryResult result,
                           String error) {

    public static QueryJobView from(final QuestionJob job) {
        return new QueryJobView(job.getId(), job.getQuery(), job.getStatus(), job.getCreatedAt(),
                job.getResult(), job.getError());
    }
}
