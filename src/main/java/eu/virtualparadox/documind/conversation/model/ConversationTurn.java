package eu.virtualparadox.documind.conversation.model;

import java.time.Instant;

/**
 * One message of a conversation.
 *
 * @param role      {@link #ROLE_USER} or {@link #ROLE_ASSISTANT}
 * @param content   message text
 * @param timestamp when the message was recorded; may be {@code null} for client-supplied history
 * @param queryId   id of the query that produced the message, if any
 */
public record ConversationTurn(String role, String content, Instant timestamp, String queryId) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static ConversationTurn user(final String content, final String queryId) {
        return new ConversationTurn(ROLE_USER, content, Instant.now(), queryId);
    }

    public static ConversationTurn assistant(final String content, final String queryId) {
        return new ConversationTurn(ROLE_ASSISTANT, content, Instant.now(), queryId);
    }
}
