package eu.virtualparadox.readingpos.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated pool for position index builds, kept apart from request threads.
 */
public class IndexingExecutor extends ThreadPoolTaskExecutor {
}
