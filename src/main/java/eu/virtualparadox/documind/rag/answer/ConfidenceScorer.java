package eu.virtualparadox.documind.rag.answer;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Scores an answer by its shape. Rules are checked in order and the first match wins:
 * <ol>
 *   <li>longer than 500 characters and contains a markdown bold marker: 0.95</li>
 *   <li>longer than 200 characters and mentions analysis, "based on", document or context: 0.85</li>
 *   <li>longer than 100 characters: 0.75</li>
 *   <li>anything else: 0.5</li>
 * </ol>
 */
@Component
public class ConfidenceScorer {

    public static final double FORMATTED = 0.95;
    public static final double GROUNDED = 0.85;
    public static final double SUBSTANTIAL = 0.75;
    public static final double BASELINE = 0.5;

    private static final List<String> GROUNDING_KEYWORDS = List.of("analysis", "based on", "document", "context");

    public double score(final String answer) {
        if (answer == null) {
            return BASELINE;
        }

        final int length = answer.length();
        if (length > 500 && answer.contains("**")) {
            return FORMATTED;
        }

        if (length > 200) {
            final String lower = answer.toLowerCase(Locale.ROOT);
            if (GROUNDING_KEYWORDS.stream().anyMatch(lower::contains)) {
                return GROUNDED;
            }
        }

        if (length > 100) {
            return SUBSTANTIAL;
        }
        return BASELINE;
    }
}
