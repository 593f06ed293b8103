package eu.virtualparadox.documind.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs asynchronously submitted query jobs.
 */
public class QuestionExecutor extends ThreadPoolTaskExecutor {
}
