package eu.virtualparadox.documind.rag.answer;

import eu.virtualparadox.documind.application.config.ApplicationConfig;
import eu.virtualparadox.documind.conversation.model.ConversationTurn;
import eu.virtualparadox.documind.rag.context.ContextAssembler;
import eu.virtualparadox.documind.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Turns retrieved chunks into the final answer text.
 * <p>
 * The prompt comes from {@link ContextAssembler}; the model output is followed by a source list
 * (top {@link #MAX_LISTED_SOURCES} chunks with their relevance) and a fixed analysis footer.
 * When the model is unavailable the answer is {@link #FALLBACK_ANSWER}, without footers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseSynthesizer {

    public static final int MAX_LISTED_SOURCES = 5;

    public static final String FALLBACK_ANSWER = String.join("\n",
            "I apologize, but I'm currently unable to access the advanced AI service. This could be because:",
            "",
            "1. Ollama is not installed or running",
            "2. No LLM models are available",
            "3. Network connectivity issues",
            "",
            "To enable full AI functionality, please:",
            "1. Install Ollama from https://ollama.ai",
            "2. Run: `ollama pull llama3.2`",
            "3. Start Ollama service",
            "",
            "For now, I can provide basic document analysis based on the available content.");

    private static final String ANALYSIS_FOOTER = String.join("\n",
            "",
            "",
            "---",
            "",
            "**Analysis Information:**",
            "- Query processed using advanced LLM (Ollama)",
            "- Analyzed %d relevant document sections",
            "- Response generated with comprehensive context understanding",
            "- Confidence level: High (LLM-powered analysis)");

    private final ContextAssembler contextAssembler;
    private final TextCompletionProvider completionProvider;
    private final ApplicationConfig config;

    /**
     * Outcome of a synthesis attempt.
     *
     * @param answer      final answer text
     * @param synthesized {@code false} when {@code answer} is the fallback text
     */
    public record Synthesis(String answer, boolean synthesized) {
    }

    public Synthesis synthesize(final String query,
                                final List<SearchResult> results,
                                final List<ConversationTurn> history) {
        final String prompt = contextAssembler.assemble(query, results, history);
        log.debug("Prompt:\n{}", prompt);

        final String completion;
        try {
            completion = completionProvider.complete(prompt, CompletionOptions.from(config.getLlm()));
        } catch (final SynthesisUnavailableException e) {
            log.warn("Answer synthesis unavailable, using fallback answer: {}", e.getMessage());
            return new Synthesis(FALLBACK_ANSWER, false);
        }

        return new Synthesis(completion + sourcesFooter(results) + String.format(Locale.ROOT, ANALYSIS_FOOTER, results.size()), true);
    }

    String sourcesFooter(final List<SearchResult> results) {
        final StringBuilder sb = new StringBuilder("\n\n**Document Sources:**\n");
        for (int i = 0; i < Math.min(MAX_LISTED_SOURCES, results.size()); i++) {
            final SearchResult r = results.get(i);
            sb.append(i + 1).append(". ")
                    .append(StringUtils.defaultIfBlank(r.filename(), "Unknown"))
                    .append(String.format(Locale.ROOT, " (Relevance: %.1f%%)", r.similarity() * 100))
                    .append('\n');
        }
        return sb.toString();
    }
}
