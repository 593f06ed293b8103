package eu.virtualparadox.documind.application.config;

import eu.virtualparadox.documind.application.executor.CompletionExecutor;
import eu.virtualparadox.documind.application.executor.EmbeddingExecutor;
import eu.virtualparadox.documind.application.executor.QuestionExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public EmbeddingExecutor embeddingExecutor(final ApplicationConfig config) {
        final int threads = Math.max(1, config.getIngest().getEmbeddingThreads());
        EmbeddingExecutor executor = new EmbeddingExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);   // bounded, callers queue behind it
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("embed-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public QuestionExecutor questionExecutor() {
        QuestionExecutor executor = new QuestionExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("question-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public CompletionExecutor completionExecutor() {
        CompletionExecutor executor = new CompletionExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("llm-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
