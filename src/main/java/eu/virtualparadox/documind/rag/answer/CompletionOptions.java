package eu.virtualparadox.documind.rag.answer;

import eu.virtualparadox.documind.application.config.ApplicationConfig;

import java.util.List;

/**
 * Sampling options passed to a {@link TextCompletionProvider}.
 *
 * @param temperature   sampling temperature
 * @param maxTokens     upper bound on generated tokens
 * @param stopSequences generation stops at the first of these
 */
public record CompletionOptions(double temperature, int maxTokens, List<String> stopSequences) {

    public CompletionOptions {
        stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
    }

    public static CompletionOptions from(final ApplicationConfig.Llm llm) {
        return new CompletionOptions(llm.getTemperature(), llm.getMaxTokens(), llm.getStopSequences());
    }
}
