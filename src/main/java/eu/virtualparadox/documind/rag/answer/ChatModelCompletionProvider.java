package eu.virtualparadox.documind.rag.answer;

import eu.virtualparadox.documind.application.config.ApplicationConfig;
import eu.virtualparadox.documind.application.executor.CompletionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link TextCompletionProvider} backed by a Spring AI {@link ChatModel} (Ollama by default).
 * <p>
 * The blocking model call runs on the {@link CompletionExecutor}; the caller waits at most
 * {@code documind.llm.timeout} and the call is cancelled when the wait runs out.
 */
@Slf4j
@Service
public class ChatModelCompletionProvider implements TextCompletionProvider {

    private final ChatModel chatModel;
    private final CompletionExecutor completionExecutor;
    private final Duration timeout;

    public ChatModelCompletionProvider(final ChatModel chatModel,
                                       final CompletionExecutor completionExecutor,
                                       final ApplicationConfig config) {
        this.chatModel = chatModel;
        this.completionExecutor = completionExecutor;
        this.timeout = config.getLlm().getTimeout();
    }

    @Override
    public String complete(final String prompt, final CompletionOptions options) {
        final Prompt request = new Prompt(prompt, ChatOptions.builder()
                .temperature(options.temperature())
                .maxTokens(options.maxTokens())
                .stopSequences(options.stopSequences())
                .build());

        final Future<String> future = completionExecutor.submit(() -> call(request));
        try {
            final String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Got response from language model ({} characters)", text.length());
            return text;
        } catch (final TimeoutException e) {
            future.cancel(true);
            throw new SynthesisUnavailableException("Language model did not answer within " + timeout, e);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SynthesisUnavailableException("Interrupted while waiting for the language model", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof SynthesisUnavailableException sue) {
                throw sue;
            }
            throw new SynthesisUnavailableException("Language model call failed: " + cause.getMessage(), cause);
        }
    }

    private String call(final Prompt request) {
        final ChatResponse response = chatModel.call(request);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new SynthesisUnavailableException("Language model returned no result");
        }

        final String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new SynthesisUnavailableException("Language model returned an empty completion");
        }
        return text;
    }
}
