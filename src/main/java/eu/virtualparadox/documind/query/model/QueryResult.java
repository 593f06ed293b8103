package eu.virtualparadox.documind.query.model;

import eu.virtualparadox.documind.conversation.model.ConversationTurn;

import java.time.Instant;
import java.util.List;

/**
 * @param answer              final answer text
 * @param sources             retrieved chunks, most similar first
 * @param confidence          heuristic confidence in [0, 1]; 0 when nothing was synthesized
 * @param queryId             unique id of this query
 * @param timestamp           when the query was answered
 * @param documentSearched    filename of the best matching document, or {@code null}
 * @param conversationUpdated whether the question and answer were appended to the session
 * @param history             conversation turns given to the model as context
 */
public record QueryResult(String answer,
                          List<Source> sources,
                          double confidence,
                          String queryId,
                          Instant timestamp,
                          String documentSearched,
                          boolean conversationUpdated,
                          List<ConversationTurn> history) {
}
