package eu.virtualparadox.documind.rag.answer;

import eu.virtualparadox.documind.application.config.ApplicationConfig;
import eu.virtualparadox.documind.rag.context.ContextAssembler;
import eu.virtualparadox.documind.rag.index.ChunkMetadata;
import eu.virtualparadox.documind.rag.retriever.model.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ResponseSynthesizerTest {

    private final ApplicationConfig config = new ApplicationConfig();

    private static SearchResult result(String filename, float similarity) {
        ChunkMetadata metadata = new ChunkMetadata("d", "u", 0, filename, ".txt", Instant.EPOCH);
        return new SearchResult("d_00000", "Chunk about " + filename, metadata, similarity);
    }

    private ResponseSynthesizer synthesizer(TextCompletionProvider provider) {
        return new ResponseSynthesizer(new ContextAssembler(), provider, config);
    }

    @Test
    @DisplayName("The model output is followed by the source list and the analysis footer")
    void appendsFooters() {
        AtomicReference<String> seenPrompt = new AtomicReference<>();
        AtomicReference<CompletionOptions> seenOptions = new AtomicReference<>();
        ResponseSynthesizer synthesizer = synthesizer((prompt, options) -> {
            seenPrompt.set(prompt);
            seenOptions.set(options);
            return "Solar panels convert light.";
        });

        ResponseSynthesizer.Synthesis synthesis = synthesizer.synthesize("What do panels do?",
                List.of(result("solar.pdf", 0.912f), result("grid.txt", 0.5f)), List.of());

        assertTrue(synthesis.synthesized());
        assertThat(synthesis.answer())
                .startsWith("Solar panels convert light.\n\n**Document Sources:**\n"
                        + "1. solar.pdf (Relevance: 91.2%)\n"
                        + "2. grid.txt (Relevance: 50.0%)\n")
                .contains("**Analysis Information:**")
                .contains("- Analyzed 2 relevant document sections");

        assertThat(seenPrompt.get()).contains("Document 1: solar.pdf (Relevance: 0.91)");
        assertEquals(0.7, seenOptions.get().temperature());
        assertEquals(2000, seenOptions.get().maxTokens());
        assertEquals(List.of("Human:", "Assistant:", "User:", "System:"), seenOptions.get().stopSequences());
    }

    @Test
    @DisplayName("At most five sources are listed, the analysis footer counts all of them")
    void sourceListCapped() {
        List<SearchResult> results = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            results.add(result("file" + i + ".txt", 0.9f - i * 0.1f));
        }

        String answer = synthesizer((prompt, options) -> "Answer.").synthesize("q", results, null).answer();

        assertThat(answer)
                .contains("5. file4.txt")
                .doesNotContain("6. file5.txt")
                .contains("- Analyzed 7 relevant document sections");
    }

    @Test
    @DisplayName("An unavailable model yields the fallback answer without footers")
    void fallback() {
        ResponseSynthesizer synthesizer = synthesizer((prompt, options) -> {
            throw new SynthesisUnavailableException("connection refused");
        });

        ResponseSynthesizer.Synthesis synthesis = synthesizer.synthesize("q", List.of(result("a.txt", 0.9f)), List.of());

        assertFalse(synthesis.synthesized());
        assertEquals(ResponseSynthesizer.FALLBACK_ANSWER, synthesis.answer());
        assertThat(synthesis.answer()).doesNotContain("**Document Sources:**");
    }

    @Test
    @DisplayName("Other failures are not mistaken for an unavailable model")
    void otherFailuresPropagate() {
        ResponseSynthesizer synthesizer = synthesizer((prompt, options) -> {
            throw new IllegalStateException("bug");
        });

        assertThrows(IllegalStateException.class,
                () -> synthesizer.synthesize("q", List.of(result("a.txt", 0.9f)), List.of()));
    }
}
