package com.foreman.core.concurrency;

import com.foreman.core.worktree.WorktreeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConcurrencyManagerTest {

    private ConcurrencyManager manager;

    @BeforeEach
    void setUp() {
        WorktreeResolver resolver = mock(WorktreeResolver.class);
        when(resolver.getPrimaryBranch(anyString())).thenReturn("main");
        manager = new ConcurrencyManager(resolver);
    }

    @Nested
    @DisplayName("acquire and release")
    class AcquireRelease {

        @Test
        @DisplayName("registers a running feature")
        void acquire() {
            RunningFeature entry = manager.acquire("F-1", "/repo", null, true, false);

            assertTrue(manager.isRunning("F-1"));
            assertEquals("F-1", entry.featureId());
            assertTrue(entry.isAutoMode());
            assertEquals(1, manager.getRunningCount());
        }

        @Test
        @DisplayName("second acquire of the same feature fails")
        void duplicateAcquire() {
            manager.acquire("F-1", "/repo", null, false, false);

            var e = assertThrows(IllegalStateException.class,
                    () -> manager.acquire("F-1", "/repo", "dev", false, false));
            assertTrue(e.getMessage().contains("already running"));
        }

        @Test
        @DisplayName("reuse adds a lease that must be released too")
        void reuse() {
            RunningFeature first = manager.acquire("F-1", "/repo", null, false, false);
            RunningFeature second = manager.acquire("F-1", "/repo", null, false, true);

            assertSame(first, second);
            manager.release("F-1");
            assertTrue(manager.isRunning("F-1"));
            manager.release("F-1");
            assertFalse(manager.isRunning("F-1"));
        }

        @Test
        @DisplayName("force release drops every lease")
        void forceRelease() {
            manager.acquire("F-1", "/repo", null, false, false);
            manager.acquire("F-1", "/repo", null, false, true);

            manager.release("F-1", true);

            assertFalse(manager.isRunning("F-1"));
        }

        @Test
        @DisplayName("releasing an unknown feature is a no-op")
        void releaseUnknown() {
            assertDoesNotThrow(() -> manager.release("nope"));
        }

        @Test
        @DisplayName("a stale entry cannot release a newer run")
        void staleEntryRelease() {
            RunningFeature stale = manager.acquire("F-1", "/repo", null, false, false);
            manager.release("F-1", true);
            RunningFeature fresh = manager.acquire("F-1", "/repo", null, false, false);

            manager.release(stale);

            assertTrue(manager.isRunning("F-1"));
            assertSame(fresh, manager.getRunningFeature("F-1").orElseThrow());
        }
    }

    @Nested
    @DisplayName("partition accounting")
    class Partitions {

        @Test
        @DisplayName("counts per worktree, primary branch counts as main")
        void countsPerWorktree() {
            manager.acquire("F-1", "/repo", null, false, false);
            manager.acquire("F-2", "/repo", "main", false, false);
            manager.acquire("F-3", "/repo", "dev", false, false);
            manager.acquire("F-4", "/other", null, false, false);

            assertEquals(2, manager.getRunningCountForWorktree("/repo", null));
            assertEquals(2, manager.getRunningCountForWorktree("/repo", "main"));
            assertEquals(List.of("F-3"), manager.getRunningFeaturesForWorktree("/repo", "dev"));
            assertEquals(1, manager.getRunningCountForWorktree("/other", ""));
            assertEquals(4, manager.getAllRunning().size());
        }
    }

    @Test
    @DisplayName("concurrent acquires of one feature admit exactly one")
    void concurrentAcquire() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<Boolean>>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        manager.acquire("F-1", "/repo", null, true, false);
                        return true;
                    } catch (IllegalStateException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int acquired = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(5, TimeUnit.SECONDS)) {
                    acquired++;
                }
            }
            assertEquals(1, acquired);
            assertEquals(1, manager.getRunningCount());
        } finally {
            pool.shutdownNow();
        }
    }
}
