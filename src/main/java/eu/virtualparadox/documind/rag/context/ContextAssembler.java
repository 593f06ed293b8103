package eu.virtualparadox.documind.rag.context;

import eu.virtualparadox.documind.conversation.model.ConversationTurn;
import eu.virtualparadox.documind.rag.retriever.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds the single prompt sent to the language model.
 * <p>
 * Layout:
 * <ol>
 *   <li>Instruction preamble naming the assistant and the detected answer language</li>
 *   <li>Up to {@link #HISTORY_TURNS} previous turns under {@code Previous conversation:}</li>
 *   <li>Each retrieved chunk as {@code Document N: <filename> (Relevance: <similarity>)}</li>
 *   <li>The question and the instruction to answer in the detected language</li>
 * </ol>
 */
@Slf4j
@Component
public class ContextAssembler {

    public static final int HISTORY_TURNS = 3;

    private static final String UNKNOWN_FILENAME = "Unknown";

    private static final String SYSTEM_PROMPT = String.join("\n",
            "You are DocuMind, an advanced AI-powered document analysis assistant. You excel at:",
            "- Analyzing and understanding complex documents",
            "- Providing comprehensive, detailed answers",
            "- Extracting key insights and information",
            "- Explaining technical concepts clearly",
            "- Summarizing large amounts of information",
            "- Answering questions with high accuracy",
            "- Supporting multiple languages (currently detected: %s)",
            "",
            "Guidelines:",
            "- Always provide detailed, comprehensive responses",
            "- Use proper formatting with headers, bullet points, and structure",
            "- Cite specific information from the documents",
            "- Be professional and informative",
            "- If information is not available, clearly state this",
            "- Provide context and analysis, not just raw answers",
            "- Respond in the same language as the user's question");

    private static final String CLOSING_INSTRUCTION =
            "Please provide a comprehensive, detailed response based on the document context above. "
                    + "Structure your answer with clear sections, use formatting, and provide thorough analysis. "
                    + "Respond in %s.";

    /**
     * @param query   the user question
     * @param results retrieved chunks, best first
     * @param history earlier turns, oldest first; may be {@code null}
     * @return the complete prompt
     */
    public String assemble(final String query,
                           final List<SearchResult> results,
                           final List<ConversationTurn> history) {
        final String language = ELanguage.detect(query).getDisplayName();

        final String prompt = String.format(SYSTEM_PROMPT, language)
                + "\n\n"
                + renderHistory(history)
                + "\n\n"
                + "Document Context:\n"
                + renderContext(results)
                + "\n\n"
                + "User Question (" + language + "): " + query
                + "\n\n"
                + String.format(CLOSING_INSTRUCTION, language);

        log.debug("Assembled prompt ({} chars, {} documents, language {})", prompt.length(), results.size(), language);
        return prompt;
    }

    /**
     * Renders the last {@link #HISTORY_TURNS} turns, or an empty string without history.
     */
    String renderHistory(final List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return "";
        }

        final StringBuilder sb = new StringBuilder("\n\nPrevious conversation:\n");
        for (final ConversationTurn turn : history.subList(Math.max(0, history.size() - HISTORY_TURNS), history.size())) {
            sb.append("- ")
                    .append(StringUtils.defaultIfBlank(turn.role(), ConversationTurn.ROLE_USER))
                    .append(": ")
                    .append(StringUtils.defaultString(turn.content()))
                    .append('\n');
        }
        return sb.toString();
    }

    String renderContext(final List<SearchResult> results) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < results.size(); i++) {
            final SearchResult r = results.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append("Document ").append(i + 1).append(": ")
                    .append(StringUtils.defaultIfBlank(r.filename(), UNKNOWN_FILENAME))
                    .append(String.format(Locale.ROOT, " (Relevance: %.2f)", r.similarity()))
                    .append('\n')
                    .append("Content: ").append(r.text())
                    .append('\n');
        }
        return sb.toString();
    }
}
