package eu.virtualparadox.documind.query.model;

import eu.virtualparadox.documind.conversation.model.ConversationTurn;

import java.util.List;

/**
 * @param query               the question
 * @param maxResults          number of chunks to retrieve; {@code null} for the configured default
 * @param documentId          restrict retrieval to one document, optional
 * @param sessionId           conversation session to read history from and append to, optional
 * @param conversationHistory explicit history, used instead of the stored session history when present
 */
public record QueryRequest(String query,
                           Integer maxResults,
                           String documentId,
                           String sessionId,
                           List<ConversationTurn> conversationHistory) {

    public static QueryRequest of(final String query) {
        return new QueryRequest(query, null, null, null, null);
    }
}
