package com.ringside.roster.lock;

import com.ringside.roster.core.model.EntityRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LocalEntityLockTest {

    private static final EntityRef WRESTLER = EntityRef.wrestler("w-1");
    private static final EntityRef TITLE = EntityRef.title("t-1");

    @Nested
    @DisplayName("Acquire and release")
    class AcquireRelease {

        @Test
        @DisplayName("Should acquire and release an entity lock")
        void testAcquireRelease() {
            LocalEntityLock lock = new LocalEntityLock();
            assertDoesNotThrow(() -> lock.acquire(WRESTLER));
            assertDoesNotThrow(() -> lock.release(WRESTLER));
        }

        @Test
        @DisplayName("Should let the holding thread acquire again")
        void testReentrant() {
            LocalEntityLock lock = new LocalEntityLock();
            EntityRef team = EntityRef.tagTeam("tt-1");
            lock.acquire(team);
            lock.acquire(team);
            lock.release(team);
            assertEquals(1, lock.trackedEntities());
            lock.release(team);
            assertEquals(0, lock.trackedEntities());
        }

        @Test
        @DisplayName("Should ignore a release by a thread that does not hold the lock")
        void testReleaseUnheld() {
            LocalEntityLock lock = new LocalEntityLock();
            assertDoesNotThrow(() -> lock.release(EntityRef.manager("none")));
            assertEquals(0, lock.trackedEntities());
        }

        @Test
        @DisplayName("Should reject a non-positive timeout")
        void testRejectsNonPositiveTimeout() {
            assertThrows(IllegalArgumentException.class, () -> new LocalEntityLock(Duration.ZERO));
            assertEquals(LocalEntityLock.DEFAULT_TIMEOUT, new LocalEntityLock().getTimeout());
        }
    }

    @Nested
    @DisplayName("Contention")
    class Contention {

        @Test
        @DisplayName("Should serialize threads on the same entity")
        void testConcurrentBlocking() throws Exception {
            LocalEntityLock lock = new LocalEntityLock(Duration.ofSeconds(2));
            EntityRef shared = EntityRef.wrestler("shared");
            AtomicInteger concurrentCount = new AtomicInteger(0);
            AtomicInteger maxConcurrent = new AtomicInteger(0);

            int threadCount = 5;
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            CountDownLatch startLatch = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            for (int i = 0; i < threadCount; i++) {
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    lock.acquire(shared);
                    try {
                        int current = concurrentCount.incrementAndGet();
                        maxConcurrent.updateAndGet(max -> Math.max(max, current));
                        Thread.sleep(20);
                        concurrentCount.decrementAndGet();
                    } finally {
                        lock.release(shared);
                    }
                    return null;
                }));
            }

            startLatch.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
            executor.shutdown();

            assertEquals(1, maxConcurrent.get());
            assertEquals(0, lock.trackedEntities());
        }

        @Test
        @DisplayName("Should time out naming the entity when another thread holds it")
        void testTimeout() throws Exception {
            LocalEntityLock lock = new LocalEntityLock(Duration.ofMillis(200));
            ExecutorService executor = Executors.newSingleThreadExecutor();
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Future<?> holder = executor.submit(() -> {
                lock.acquire(TITLE);
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
                lock.release(TITLE);
                return null;
            });

            held.await(5, TimeUnit.SECONDS);
            try {
                LockAcquisitionException e = assertThrows(LockAcquisitionException.class, () -> lock.acquire(TITLE));
                assertEquals(TITLE, e.getEntity());
                assertTrue(e.getMessage().contains("200ms"));
            } finally {
                release.countDown();
                holder.get(5, TimeUnit.SECONDS);
                executor.shutdown();
            }
        }

        @Test
        @DisplayName("Should hand the lock to a waiting thread and drop it once both are done")
        void testHandOverThenEvict() throws Exception {
            LocalEntityLock lock = new LocalEntityLock(Duration.ofSeconds(5));
            ExecutorService executor = Executors.newSingleThreadExecutor();
            CountDownLatch waiting = new CountDownLatch(1);
            lock.acquire(WRESTLER);

            Future<?> waiter = executor.submit(() -> {
                waiting.countDown();
                lock.acquire(WRESTLER);
                lock.release(WRESTLER);
                return null;
            });
            waiting.await(5, TimeUnit.SECONDS);
            Thread.sleep(100);
            assertFalse(waiter.isDone());

            lock.release(WRESTLER);

            waiter.get(5, TimeUnit.SECONDS);
            executor.shutdown();
            assertEquals(0, lock.trackedEntities());
        }
    }
}
