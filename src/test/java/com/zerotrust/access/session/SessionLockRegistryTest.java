package com.zerotrust.access.session;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionLockRegistryTest {

    @Test
    void sameSessionAlwaysMapsToSameLock() {
        SessionLockRegistry registry = new SessionLockRegistry(16);

        assertThat(registry.lockFor("session-42")).isSameAs(registry.lockFor("session-42"));
    }

    @Test
    void lockIsReleasedWhenWorkThrows() {
        SessionLockRegistry registry = new SessionLockRegistry(4);

        assertThatThrownBy(() -> registry.withLock("s-1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(registry.lockFor("s-1").isLocked()).isFalse();
    }

    @Test
    void workOnOneSessionIsSerialized() throws Exception {
        SessionLockRegistry registry = new SessionLockRegistry(8);
        int[] counter = {0};
        int threads = 8;
        int iterations = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < iterations; i++) {
                        registry.withLock("shared", () -> counter[0]++);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(counter[0]).isEqualTo(threads * iterations);
    }

    @Test
    void rejectsNonPositiveStripeCount() {
        assertThatThrownBy(() -> new SessionLockRegistry(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
