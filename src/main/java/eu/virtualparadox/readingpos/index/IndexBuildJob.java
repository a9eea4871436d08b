package eu.virtualparadox.readingpos.index;

import java.time.Instant;
import java.util.concurrent.Future;

/**
 * One queued rebuild of a book's position index.
 * <p>Status only moves through {@link #transition}, so a cancel and an install cannot both win:
 * the worker needs {@code WALKING -> INSTALLING} before it may swap the index in, and
 * {@link PositionIndexManager#cancel} needs {@code QUEUED/WALKING -> CANCELLED}.</p>
 */
public class IndexBuildJob {
    private final long id;
    private final String bookId;
    private final Instant createdAt;
    private volatile EIndexBuildStatus status;
    private volatile String failure;
    private volatile Instant finishedAt;
    private volatile Future<?> future;

    public IndexBuildJob(long id, String bookId) {
        this.id = id;
        this.bookId = bookId;
        this.status = EIndexBuildStatus.QUEUED;
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public String getBookId() { return bookId; }
    public Instant getCreatedAt() { return createdAt; }
    public EIndexBuildStatus getStatus() { return status; }
    public String getFailure() { return failure; }
    public Instant getFinishedAt() { return finishedAt; }
    Future<?> getFuture() { return future; }

    void setFuture(Future<?> future) { this.future = future; }

    /**
     * Moves the job from {@code from} to {@code to}.
     *
     * @param failure reason recorded with the transition, may be {@code null}
     * @return false if the job was not in {@code from}; nothing is changed then
     */
    synchronized boolean transition(EIndexBuildStatus from, EIndexBuildStatus to, String failure) {
        if (status != from) {
            return false;
        }
        if (failure != null) {
            this.failure = failure;
        }
        if (to.isFinal()) {
            this.finishedAt = Instant.now();
        }
        this.status = to;
        return true;
    }
}
