package com.mirrorwatch.scanner.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs a reactive task at a fixed cadence without overlap.
 *
 * <pre>
 *   delay(initial) → run task → delay(interval − elapsed, at least 0) → run task → ...
 * </pre>
 *
 * <p>Each run is a fresh {@link Mono} pipeline whose terminal {@code subscribe()} schedules the
 * next run, so nothing nests and no thread waits. A failing or throwing task is logged and the
 * loop carries on at the normal cadence.
 */
public class PeriodicLoop {

    private static final Logger log = LoggerFactory.getLogger(PeriodicLoop.class);

    private final String               name;
    private final Duration             interval;
    private final Supplier<Mono<?>>    task;
    private final Scheduler            scheduler;
    private final AtomicBoolean        stopped = new AtomicBoolean();
    private volatile Disposable        pending;

    public PeriodicLoop(String name, Duration interval, Supplier<Mono<?>> task, Scheduler scheduler) {
        this.name      = name;
        this.interval  = interval;
        this.task      = task;
        this.scheduler = scheduler;
    }

    public void start(Duration initialDelay) {
        log.info("LOOP_STARTED loop={} initialDelaySeconds={} intervalSeconds={}",
                 name, initialDelay.toSeconds(), interval.toSeconds());
        scheduleNext(initialDelay);
    }

    public void stop() {
        stopped.set(true);
        Disposable current = pending;
        if (current != null) {
            current.dispose();
        }
        log.info("LOOP_STOPPED loop={}", name);
    }

    public boolean isStopped() {
        return stopped.get();
    }

    // ── loop ──────────────────────────────────────────────────────────────────

    private void scheduleNext(Duration delay) {
        if (stopped.get()) {
            return;
        }
        pending = Mono.delay(delay, scheduler)
            .then(Mono.defer(this::runOnce))
            .subscribe(
                elapsed -> scheduleNext(nextDelay(interval, elapsed)),
                err -> {
                    log.error("Loop run failed, rescheduling. loop={}", name, err);
                    scheduleNext(interval);
                });
    }

    private Mono<Duration> runOnce() {
        long started = System.nanoTime();
        return Mono.defer(task)
            .onErrorResume(e -> {
                log.error("Loop task failed. loop={}", name, e);
                return Mono.empty();
            })
            .then(Mono.fromSupplier(() -> Duration.ofNanos(System.nanoTime() - started)))
            .doOnNext(elapsed -> log.debug("Loop run finished. loop={} elapsedMs={}", name, elapsed.toMillis()));
    }

    static Duration nextDelay(Duration interval, Duration elapsed) {
        Duration remaining = interval.minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Initial delay so that a restart does not repeat work done shortly before it:
     * {@code last run + interval − now}, at least 0. Without a previous run the loop starts at once.
     */
    static Duration initialDelay(Instant lastRun, Duration interval, Instant now) {
        if (lastRun == null) {
            return Duration.ZERO;
        }
        return nextDelay(interval, Duration.between(lastRun, now));
    }
}
