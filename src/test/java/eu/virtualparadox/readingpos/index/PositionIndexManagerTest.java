package eu.virtualparadox.readingpos.index;

import eu.virtualparadox.readingpos.application.executor.IndexingExecutor;
import eu.virtualparadox.readingpos.document.DocumentFragment;
import eu.virtualparadox.readingpos.document.DocumentWalker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static eu.virtualparadox.readingpos.document.Chapters.chapter;
import static org.junit.jupiter.api.Assertions.*;

class PositionIndexManagerTest {

    private IndexingExecutor executor;
    private PositionIndexRegistry indexRegistry;
    private IndexBuildRegistry jobRegistry;
    private PositionIndexManager manager;

    @BeforeEach
    void setUp() {
        executor = new IndexingExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("test-index-");
        executor.initialize();

        indexRegistry = new PositionIndexRegistry(new PositionIndexBuilder(new DocumentWalker()));
        jobRegistry = new IndexBuildRegistry(Duration.ofHours(1));
        manager = new PositionIndexManager(indexRegistry, jobRegistry, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("A submitted build ends INSTALLED and the index is available")
    void testInstalled() throws Exception {
        IndexBuildJob job = manager.submitRebuild("b", () -> List.of(chapter(1, "<p>a</p>")));

        awaitFinal(job);

        assertEquals(EIndexBuildStatus.INSTALLED, job.getStatus());
        assertTrue(indexRegistry.current("b").isPresent());
        assertSame(job, manager.getJob(job.getId()).orElseThrow());
    }

    @Test
    @DisplayName("A failing source ends FAILED with the reason")
    void testFailed() throws Exception {
        IndexBuildJob job = manager.submitRebuild("b", () -> {
            throw new IOException("unreadable epub");
        });

        awaitFinal(job);

        assertEquals(EIndexBuildStatus.FAILED, job.getStatus());
        assertTrue(job.getFailure().contains("unreadable epub"));
    }

    @Test
    @DisplayName("Cancelling a running build keeps the previous index")
    void testCancelRunning() throws Exception {
        indexRegistry.rebuild("b", List.of(chapter(1, "<p>old</p>")));
        PositionIndex previous = indexRegistry.current("b").orElseThrow();

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        IndexBuildJob job = manager.submitRebuild("b", () -> {
            started.countDown();
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted while loading", e);
            }
            return List.of(chapter(1, "<p>new</p>"));
        });

        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(manager.cancel(job.getId()));
        awaitFinal(job);

        assertEquals(EIndexBuildStatus.CANCELLED, job.getStatus());
        assertSame(previous, indexRegistry.current("b").orElseThrow());
        assertFalse(manager.cancel(job.getId()), "final jobs cannot be cancelled again");
    }

    @Test
    @DisplayName("A cancelled build never installs, even if it finishes its walk")
    void testCancelledBuildNeverInstalls() throws Exception {
        AtomicBoolean block = new AtomicBoolean(false);
        CountDownLatch building = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PositionIndexBuilder interruptIgnoring = new PositionIndexBuilder(new DocumentWalker()) {
            @Override
            public PositionIndex build(String bookId, List<DocumentFragment> fragments) {
                if (block.get()) {
                    building.countDown();
                    awaitIgnoringInterrupts(release);
                }
                return super.build(bookId, fragments);
            }
        };
        PositionIndexRegistry registry = new PositionIndexRegistry(interruptIgnoring);
        PositionIndexManager managerUnderTest = new PositionIndexManager(registry, jobRegistry, executor);

        registry.rebuild("b", List.of(chapter(1, "<p>old</p>")));
        PositionIndex previous = registry.current("b").orElseThrow();
        block.set(true);

        IndexBuildJob job = managerUnderTest.submitRebuild("b",
                () -> List.of(chapter(1, "<p>new</p><p>newer</p>")));

        assertTrue(building.await(5, TimeUnit.SECONDS));
        assertTrue(managerUnderTest.cancel(job.getId()));
        release.countDown();

        executor.getThreadPoolExecutor().shutdown();
        assertTrue(executor.getThreadPoolExecutor().awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(EIndexBuildStatus.CANCELLED, job.getStatus());
        assertSame(previous, registry.current("b").orElseThrow());
    }

    @Test
    @DisplayName("A job that is installing can no longer be cancelled")
    void testCancelRefusedWhileInstalling() {
        IndexBuildJob job = jobRegistry.createJob("b");
        assertTrue(job.transition(EIndexBuildStatus.QUEUED, EIndexBuildStatus.WALKING, null));
        assertTrue(job.transition(EIndexBuildStatus.WALKING, EIndexBuildStatus.INSTALLING, null));

        assertFalse(manager.cancel(job.getId()));
        assertEquals(EIndexBuildStatus.INSTALLING, job.getStatus());
    }

    @Test
    @DisplayName("Unknown job ids cannot be cancelled")
    void testCancelUnknown() {
        assertFalse(manager.cancel(999));
        assertTrue(manager.getJob(999).isEmpty());
    }

    /**
     * Waits like a build that swallows interrupts and finishes its walk anyway.
     */
    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        while (latch.getCount() > 0) {
            try {
                latch.await();
            } catch (InterruptedException e) {
                Thread.interrupted();
            }
        }
    }

    private static void awaitFinal(IndexBuildJob job) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!job.getStatus().isFinal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(job.getStatus().isFinal(), "job did not finish in time: " + job.getStatus());
    }
}
