package eu.virtualparadox.readingpos.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class IndexBuildRegistryTest {

    @Test
    @DisplayName("Finished jobs past retention are evicted, running ones stay")
    void testEvictFinished() {
        IndexBuildRegistry registry = new IndexBuildRegistry(Duration.ZERO);
        IndexBuildJob done = registry.createJob("a");
        IndexBuildJob running = registry.createJob("b");

        assertTrue(done.transition(EIndexBuildStatus.QUEUED, EIndexBuildStatus.CANCELLED, "cancelled by request"));
        assertTrue(running.transition(EIndexBuildStatus.QUEUED, EIndexBuildStatus.WALKING, null));

        assertEquals(1, registry.evictFinished());
        assertTrue(registry.getJob(done.getId()).isEmpty());
        assertTrue(registry.getJob(running.getId()).isPresent());
    }

    @Test
    @DisplayName("Finished jobs within retention stay pollable")
    void testRetention() {
        IndexBuildRegistry registry = new IndexBuildRegistry(Duration.ofHours(1));
        IndexBuildJob job = registry.createJob("a");
        job.transition(EIndexBuildStatus.QUEUED, EIndexBuildStatus.CANCELLED, null);

        registry.createJob("b");

        assertTrue(registry.getJob(job.getId()).isPresent());
        assertEquals(0, registry.evictFinished());
    }

    @Test
    @DisplayName("Transitions only apply from the expected state")
    void testTransitions() {
        IndexBuildJob job = new IndexBuildRegistry(Duration.ZERO).createJob("a");

        assertFalse(job.transition(EIndexBuildStatus.WALKING, EIndexBuildStatus.INSTALLING, null));
        assertTrue(job.transition(EIndexBuildStatus.QUEUED, EIndexBuildStatus.WALKING, null));
        assertTrue(job.transition(EIndexBuildStatus.WALKING, EIndexBuildStatus.FAILED, "boom"));
        assertFalse(job.transition(EIndexBuildStatus.WALKING, EIndexBuildStatus.CANCELLED, "late"));

        assertEquals(EIndexBuildStatus.FAILED, job.getStatus());
        assertEquals("boom", job.getFailure());
        assertNotNull(job.getFinishedAt());
    }

    @Test
    @DisplayName("Negative retention is rejected")
    void testNegativeRetention() {
        assertThrows(IllegalArgumentException.class, () -> new IndexBuildRegistry(Duration.ofSeconds(-1)));
    }
}
