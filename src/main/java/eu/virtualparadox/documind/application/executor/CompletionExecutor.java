package eu.virtualparadox.documind.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs blocking language-model calls so callers can wait on them with a timeout.
 */
public class CompletionExecutor extends ThreadPoolTaskExecutor {
}
