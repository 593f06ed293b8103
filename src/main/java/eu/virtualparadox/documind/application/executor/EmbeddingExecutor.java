package eu.virtualparadox.documind.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool that embeds the chunks of a document concurrently during ingestion.
 */
public class EmbeddingExecutor extends ThreadPoolTaskExecutor {
}
