package eu.virtualparadox.documind.rag.answer;

/**
 * Opaque text-completion backend.
 */
public interface TextCompletionProvider {

    /**
     * @param prompt  complete prompt text
     * @param options sampling options
     * @return the generated, non-blank text
     * @throws SynthesisUnavailableException on provider failure, timeout or empty output
     */
    String complete(final String prompt, final CompletionOptions options);

}
