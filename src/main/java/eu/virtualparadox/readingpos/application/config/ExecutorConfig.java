package eu.virtualparadox.readingpos.application.config;

import eu.virtualparadox.readingpos.application.executor.IndexingExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IndexingExecutor indexingExecutor(final ApplicationConfig config) {
        final int threads = Math.max(1, config.getIndexing().getThreads());

        IndexingExecutor executor = new IndexingExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);   // builds of one book are serialized by the registry anyway
        executor.setQueueCapacity(Integer.MAX_VALUE); // unlimited queue
        executor.setThreadNamePrefix("position-index-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(config.getIndexing().getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }
}
