package eu.virtualparadox.readingpos.index;

import eu.virtualparadox.readingpos.application.executor.IndexingExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.Future;

import static eu.virtualparadox.readingpos.index.EIndexBuildStatus.*;

/**
 * Runs index rebuilds off the caller's thread on the {@link IndexingExecutor}.
 * <p>Each submission becomes an {@link IndexBuildJob} that can be polled or cancelled.
 * Cancelling interrupts the walk; the book keeps its previous index. A job either installs or
 * is cancelled, never both: the install step is gated on the job's state.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionIndexManager {

    private static final String CANCELLED_BY_REQUEST = "cancelled by request";

    private final PositionIndexRegistry indexRegistry;
    private final IndexBuildRegistry jobRegistry;
    private final IndexingExecutor indexingExecutor;

    public IndexBuildJob submitRebuild(final String bookId, final FragmentSource source) {
        final IndexBuildJob job = jobRegistry.createJob(bookId);
        final Future<?> future = indexingExecutor.submit(() -> process(job, source));
        job.setFuture(future);
        log.info("Queued position index build {} for book {}", job.getId(), bookId);
        return job;
    }

    /**
     * Cancels a job that is queued or walking. Once the walk has finished and the index is being
     * installed, the job can no longer be cancelled and this returns false.
     *
     * @return true if the job was cancelled; its build will not install anything
     */
    public boolean cancel(final long jobId) {
        final Optional<IndexBuildJob> found = jobRegistry.getJob(jobId);
        if (found.isEmpty()) {
            return false;
        }

        final IndexBuildJob job = found.get();
        final boolean cancelled = job.transition(QUEUED, CANCELLED, CANCELLED_BY_REQUEST)
                || job.transition(WALKING, CANCELLED, CANCELLED_BY_REQUEST);
        if (!cancelled) {
            log.debug("Position index build {} is {}, not cancelling", jobId, job.getStatus());
            return false;
        }

        final Future<?> future = job.getFuture();
        if (future != null) {
            future.cancel(true);
        }
        log.info("Cancelled position index build {} for book {}", jobId, job.getBookId());
        return true;
    }

    public Optional<IndexBuildJob> getJob(final long jobId) {
        return jobRegistry.getJob(jobId);
    }

    private void process(final IndexBuildJob job, final FragmentSource source) {
        if (!job.transition(QUEUED, WALKING, null)) {
            return;
        }

        final IndexBuildOutcome outcome = indexRegistry.rebuild(job.getBookId(), source,
                () -> job.transition(WALKING, INSTALLING, null));
        if (outcome.isInstalled()) {
            job.transition(INSTALLING, INSTALLED, null);
        } else {
            job.transition(WALKING, outcome.cancelled() ? CANCELLED : FAILED, outcome.failure());
        }
    }
}
