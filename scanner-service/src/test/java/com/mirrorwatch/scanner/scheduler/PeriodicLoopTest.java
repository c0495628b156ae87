package com.mirrorwatch.scanner.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PeriodicLoopTest {

    @Test
    @DisplayName("next delay subtracts the run time and never goes negative")
    void nextDelay() {
        assertEquals(Duration.ofMinutes(10), PeriodicLoop.nextDelay(Duration.ofMinutes(15), Duration.ofMinutes(5)));
        assertEquals(Duration.ZERO, PeriodicLoop.nextDelay(Duration.ofMinutes(15), Duration.ofMinutes(20)));
    }

    @Test
    @DisplayName("initial delay resumes the cadence of the last stored run")
    void initialDelay() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");

        assertEquals(Duration.ZERO, PeriodicLoop.initialDelay(null, Duration.ofMinutes(15), now));
        assertEquals(Duration.ofMinutes(11),
            PeriodicLoop.initialDelay(now.minus(Duration.ofMinutes(4)), Duration.ofMinutes(15), now));
        assertEquals(Duration.ZERO,
            PeriodicLoop.initialDelay(now.minus(Duration.ofHours(2)), Duration.ofMinutes(15), now));
    }

    @Test
    @DisplayName("task runs repeatedly until stopped")
    void runsRepeatedly() throws InterruptedException {
        CountDownLatch runs = new CountDownLatch(3);
        PeriodicLoop loop = new PeriodicLoop("test", Duration.ofMillis(10),
            () -> Mono.fromRunnable(runs::countDown), Schedulers.parallel());

        loop.start(Duration.ZERO);
        try {
            assertTrue(runs.await(5, TimeUnit.SECONDS));
        } finally {
            loop.stop();
        }
        assertTrue(loop.isStopped());
    }

    @Test
    @DisplayName("failing and throwing tasks do not end the loop")
    void survivesFailures() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch runs = new CountDownLatch(4);
        PeriodicLoop loop = new PeriodicLoop("failing", Duration.ofMillis(10), () -> {
            runs.countDown();
            if (calls.incrementAndGet() % 2 == 0) {
                throw new IllegalStateException("boom");
            }
            return Mono.error(new IllegalStateException("failed"));
        }, Schedulers.parallel());

        loop.start(Duration.ZERO);
        try {
            assertTrue(runs.await(5, TimeUnit.SECONDS));
        } finally {
            loop.stop();
        }
    }
}
