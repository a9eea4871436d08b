package eu.virtualparadox.readingpos.index;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps index build jobs pollable by id. Finished jobs are kept for
 * {@code readingpos.indexing.job-retention} and evicted when new jobs are created.
 */
@Slf4j
@Service
public class IndexBuildRegistry {

    private final AtomicLong counter;
    private final Map<Long, IndexBuildJob> jobs;
    private final Duration retention;

    public IndexBuildRegistry(@Value("${readingpos.indexing.job-retention:PT1H}") Duration retention) {
        Objects.requireNonNull(retention, "retention must not be null");
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative");
        }
        this.counter = new AtomicLong(0);
        this.jobs = new ConcurrentHashMap<>();
        this.retention = retention;
    }

    public IndexBuildJob createJob(String bookId) {
        evictFinished();
        long id = counter.incrementAndGet();
        IndexBuildJob job = new IndexBuildJob(id, bookId);
        jobs.put(id, job);
        return job;
    }

    public Optional<IndexBuildJob> getJob(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /**
     * Drops jobs that reached a final state more than the retention period ago.
     *
     * @return number of evicted jobs
     */
    public int evictFinished() {
        Instant cutoff = Instant.now().minus(retention);
        int before = jobs.size();
        jobs.values().removeIf(job -> job.getStatus().isFinal()
                && job.getFinishedAt() != null
                && !job.getFinishedAt().isAfter(cutoff));
        int evicted = before - jobs.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished index build jobs", evicted);
        }
        return evicted;
    }
}
