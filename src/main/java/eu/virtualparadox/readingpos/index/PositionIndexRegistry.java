package eu.virtualparadox.readingpos.index;

import eu.virtualparadox.readingpos.document.DocumentFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Holds the installed {@link PositionIndex} of every book and rebuilds them.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li><b>Build, then swap</b>: a rebuild walks the whole document into a fresh index and only
 *       then replaces the map entry, a single reference write.</li>
 *   <li><b>Failures keep the old index</b>: walker errors, load errors and cancellation
 *       leave the previous index installed and are reported in the {@link IndexBuildOutcome}.</li>
 *   <li><b>One writer per book</b>: rebuilds of the same book are serialized by a per-book lock;
 *       different books build in parallel.</li>
 *   <li><b>Lock-free reads</b>: {@link #current(String)} returns whatever complete index is
 *       installed. Callers snapshot it once per operation.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionIndexRegistry {

    private final PositionIndexBuilder builder;

    private final Map<String, PositionIndex> installed = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * @return the installed index for {@code bookId}, empty if the book has not been walked yet
     */
    public Optional<PositionIndex> current(final String bookId) {
        return Optional.ofNullable(installed.get(bookId));
    }

    public IndexBuildOutcome rebuild(final String bookId, final List<DocumentFragment> fragments) {
        Objects.requireNonNull(fragments, "fragments must not be null");
        return rebuild(bookId, () -> fragments);
    }

    public IndexBuildOutcome rebuild(final String bookId, final FragmentSource source) {
        return rebuild(bookId, source, () -> true);
    }

    /**
     * Builds and installs a new index for {@code bookId}. Never throws for build failures.
     *
     * @param bookId      book identifier
     * @param source      loads the fragments; invoked while holding the book's lock
     * @param installGate asked once, under the book's lock, right before the swap; returning
     *                    false discards the finished build as cancelled
     * @return outcome of the attempt
     */
    public IndexBuildOutcome rebuild(final String bookId, final FragmentSource source, final BooleanSupplier installGate) {
        Objects.requireNonNull(bookId, "bookId must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(installGate, "installGate must not be null");

        final ReentrantLock lock;
        try {
            lock = acquire(bookId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return reportFailure(new IndexBuildException(bookId, "cancelled while waiting for a running build", true, e));
        }

        try {
            log.info("Position index build started for book {}", bookId);
            final PositionIndex index = builder.build(bookId, source.load());

            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("cancelled before install");
            }
            if (!installGate.getAsBoolean()) {
                throw new CancellationException("install refused, build was cancelled");
            }

            final PositionIndex previous = installed.put(bookId, index);
            log.info("Position index installed for book {}: {} elements (replaced {})",
                    bookId, index.size(), previous == null ? "nothing" : previous.size() + " elements");
            return IndexBuildOutcome.installed(index);
        } catch (CancellationException e) {
            return reportFailure(new IndexBuildException(bookId, e.getMessage(), true, e));
        } catch (IndexBuildException e) {
            return reportFailure(e);
        } catch (Exception e) {
            final boolean interrupted = Thread.currentThread().isInterrupted();
            return reportFailure(new IndexBuildException(bookId, String.valueOf(e.getMessage()), interrupted, e));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the index of a book, e.g. when its document is deleted. Waits for a running build of
     * the book to finish first.
     */
    public void remove(final String bookId) {
        final ReentrantLock lock = acquireUninterruptibly(bookId);
        try {
            if (installed.remove(bookId) != null) {
                log.info("Position index removed for book {}", bookId);
            }
            locks.remove(bookId, lock);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Locks the current lock of {@code bookId}. A lock dropped by {@link #remove} while a thread
     * was waiting on it is released again and the current one is taken instead.
     */
    private ReentrantLock acquire(final String bookId) throws InterruptedException {
        while (true) {
            final ReentrantLock lock = locks.computeIfAbsent(bookId, k -> new ReentrantLock());
            lock.lockInterruptibly();
            if (locks.get(bookId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    private ReentrantLock acquireUninterruptibly(final String bookId) {
        while (true) {
            final ReentrantLock lock = locks.computeIfAbsent(bookId, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(bookId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    int lockCount() {
        return locks.size();
    }

    private IndexBuildOutcome reportFailure(final IndexBuildException e) {
        if (e.isCancelled()) {
            log.warn("Position index build cancelled for book {}, keeping previous index", e.getBookId());
        } else {
            log.warn("Position index build failed for book {}, keeping previous index", e.getBookId(), e);
        }
        return IndexBuildOutcome.failed(e);
    }
}
