package eu.virtualparadox.documind.query;

import eu.virtualparadox.documind.application.config.ApplicationConfig;
import eu.virtualparadox.documind.application.executor.QuestionExecutor;
import eu.virtualparadox.documind.conversation.model.ConversationTurn;
import eu.virtualparadox.documind.conversation.service.ConversationService;
import eu.virtualparadox.documind.metrics.EDocumentAction;
import eu.virtualparadox.documind.metrics.MetricsSink;
import eu.virtualparadox.documind.query.model.QueryRequest;
import eu.virtualparadox.documind.query.model.QueryResult;
import eu.virtualparadox.documind.query.model.Source;
import eu.virtualparadox.documind.query.question.EQuestionStatus;
import eu.virtualparadox.documind.query.question.QuestionJob;
import eu.virtualparadox.documind.query.question.QuestionRegistry;
import eu.virtualparadox.documind.rag.answer.ConfidenceScorer;
import eu.virtualparadox.documind.rag.answer.ResponseSynthesizer;
import eu.virtualparadox.documind.rag.answer.ResponseSynthesizer.Synthesis;
import eu.virtualparadox.documind.rag.retriever.model.SearchResult;
import eu.virtualparadox.documind.rag.retriever.service.RetrieverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import static eu.virtualparadox.documind.query.question.EQuestionStatus.*;

/**
 * Answers questions over the owner's documents: retrieve, assemble, synthesize, score.
 * <p>
 * A query always receives an answer. Empty retrieval yields {@link #NO_RESULTS_ANSWER}, an
 * unavailable language model yields {@link ResponseSynthesizer#FALLBACK_ANSWER}; both score 0.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class QueryManager {

    public static final String NO_RESULTS_ANSWER = "I couldn't find any relevant information in the uploaded "
            + "documents to answer your question. Please make sure you have uploaded the relevant documents "
            + "and try asking a more specific question.";

    static final String ERROR_ANSWER_PREFIX = "I apologize, but I encountered an error while processing your query: ";

    static final int MAX_RESULTS_LIMIT = 50;

    private final RetrieverService retrieverService;
    private final ResponseSynthesizer responseSynthesizer;
    private final ConfidenceScorer confidenceScorer;
    private final ConversationService conversationService;
    private final MetricsSink metricsSink;
    private final QuestionRegistry registry;
    private final QuestionExecutor questionExecutor;
    private final ApplicationConfig config;

    /**
     * Answers a question synchronously.
     *
     * @param ownerId owner whose documents are searched
     * @param request the question and its options
     * @return the answer with its sources
     * @throws IllegalArgumentException if the owner or the question is blank
     */
    public QueryResult answer(final String ownerId, final QueryRequest request) {
        return answer(ownerId, request, status -> { });
    }

    private QueryResult answer(final String ownerId,
                               final QueryRequest request,
                               final Consumer<EQuestionStatus> progress) {
        requireOwner(ownerId);
        if (request == null || StringUtils.isBlank(request.query())) {
            throw new IllegalArgumentException("query must not be blank");
        }

        final long started = System.nanoTime();
        final String queryId = UUID.randomUUID().toString();
        final String query = request.query().trim();
        final int k = resolveMaxResults(request.maxResults());
        final List<ConversationTurn> history = resolveHistory(ownerId, request);

        log.info("Processing query {} for {}: '{}' (k={}, document={})", queryId, ownerId, query, k, request.documentId());

        progress.accept(RETRIEVING);
        final List<SearchResult> results = retrieverService.retrieve(query, k, request.documentId(), ownerId);
        printDebugRetrieved(results);

        final String answer;
        final double confidence;
        if (results.isEmpty()) {
            answer = NO_RESULTS_ANSWER;
            confidence = 0.0;
        } else {
            progress.accept(ANSWERING);
            final Synthesis synthesis = synthesize(query, results, history);
            answer = synthesis.answer();
            confidence = synthesis.synthesized() ? confidenceScorer.score(answer) : 0.0;
        }

        final boolean conversationUpdated = appendToSession(ownerId, request.sessionId(), query, answer, queryId);

        final Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metricsSink.recordQuery(ownerId, query, request.documentId(), elapsed);
        if (request.documentId() != null) {
            metricsSink.recordDocumentAction(ownerId, request.documentId(), EDocumentAction.QUERY);
        }
        log.info("Query {} answered in {} ms from {} chunks, confidence {}", queryId, elapsed.toMillis(), results.size(), confidence);

        return new QueryResult(
                answer,
                results.stream().map(Source::from).toList(),
                confidence,
                queryId,
                Instant.now(),
                results.isEmpty() ? null : results.get(0).filename(),
                conversationUpdated,
                history);
    }

    /**
     * Queues a question on the question executor.
     */
    public QuestionJob submitQuery(final String ownerId, final QueryRequest request) {
        requireOwner(ownerId);
        if (request == null || StringUtils.isBlank(request.query())) {
            throw new IllegalArgumentException("query must not be blank");
        }

        final QuestionJob job = registry.createJob(ownerId, request);
        registry.attach(job.getId(), questionExecutor.submit(() -> process(job)));
        return job;
    }

    public Optional<QuestionJob> getJob(final long jobId) {
        return registry.getJob(jobId);
    }

    /**
     * Cancels a queued or running job. The index is never touched by a query, so an interrupted
     * job leaves nothing behind.
     *
     * @return {@code true} if the job was still running and is now cancelled
     */
    public boolean cancel(final long jobId) {
        final boolean cancelled = registry.cancel(jobId);
        if (cancelled) {
            log.info("Job {} cancelled", jobId);
        }
        return cancelled;
    }

    private void process(final QuestionJob job) {
        if (job.getStatus().isTerminal()) {
            return;
        }
        try {
            final QueryResult result = answer(job.getOwnerId(), job.getRequest(), status -> registry.updateStatus(job.getId(), status));
            registry.complete(job.getId(), result);
        } catch (Exception ex) {
            log.error("Job {} failed", job.getId(), ex);
            registry.fail(job.getId(), ex.getMessage());
        }
    }

    /**
     * A blank owner would leave retrieval without its owner predicate.
     */
    private static void requireOwner(final String ownerId) {
        if (StringUtils.isBlank(ownerId)) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
    }

    private Synthesis synthesize(final String query,
                                 final List<SearchResult> results,
                                 final List<ConversationTurn> history) {
        try {
            return responseSynthesizer.synthesize(query, results, history);
        } catch (final RuntimeException e) {
            log.error("Answer generation failed for query: {}", query, e);
            return new Synthesis(ERROR_ANSWER_PREFIX + e.getMessage(), false);
        }
    }

    private int resolveMaxResults(final Integer requested) {
        final int k = requested == null ? config.getRetrieval().getDefaultMaxResults() : requested;
        if (k <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        return Math.min(k, MAX_RESULTS_LIMIT);
    }

    private List<ConversationTurn> resolveHistory(final String ownerId, final QueryRequest request) {
        if (request.conversationHistory() != null) {
            return List.copyOf(request.conversationHistory());
        }
        if (StringUtils.isNotBlank(request.sessionId())) {
            return conversationService.history(ownerId, request.sessionId());
        }
        return List.of();
    }

    private boolean appendToSession(final String ownerId,
                                    final String sessionId,
                                    final String query,
                                    final String answer,
                                    final String queryId) {
        if (StringUtils.isBlank(sessionId)) {
            return false;
        }
        try {
            conversationService.append(ownerId, sessionId, ConversationTurn.user(query, queryId));
            conversationService.append(ownerId, sessionId, ConversationTurn.assistant(answer, queryId));
            return true;
        } catch (final RuntimeException e) {
            log.warn("Unable to store conversation turns of session {}", sessionId, e);
            return false;
        }
    }

    private void printDebugRetrieved(final List<SearchResult> raw) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final SearchResult r : raw) {
            sb.append(" - ").append("[").append(r.similarity()).append("] ").append(r.text()).append("\n");
        }
        log.debug("Retrieved chunks:\n{}", sb);
    }
}
