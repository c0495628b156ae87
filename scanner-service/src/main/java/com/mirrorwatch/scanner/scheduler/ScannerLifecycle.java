package com.mirrorwatch.scanner.scheduler;

import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.registry.InstanceRegistryService;
import com.mirrorwatch.scanner.retention.RetentionService;
import com.mirrorwatch.scanner.stats.StatsCollector;
import com.mirrorwatch.scanner.upstream.UpstreamVersionOracle;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Starts the background loops once the application is ready.
 *
 * <pre>
 *   registry   reconcile the instance table       every registry.interval, at once
 *   upstream   refresh the upstream head          every upstream.refresh-interval, after a first refresh
 *   probe      probe all enabled instances        every probe.interval, resumed from the last tick
 *   stats      collect instance counters          every stats.interval, resumed from the last run
 *   cleanup    evict error records, old checks    every retention.cleanup-interval, at once
 * </pre>
 *
 * <p>With {@code scanner.health-checks-enabled=false} only the cleanup loop runs.
 */
@Component
public class ScannerLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ScannerLifecycle.class);

    private final InstanceRegistryService registryService;
    private final UpstreamVersionOracle   oracle;
    private final ProbeScheduler          probeScheduler;
    private final StatsCollector          statsCollector;
    private final RetentionService        retentionService;
    private final ScannerProperties       properties;
    private final Clock                   clock;
    private final Scheduler               scheduler;
    private final List<PeriodicLoop>      loops = new CopyOnWriteArrayList<>();

    public ScannerLifecycle(InstanceRegistryService registryService,
                            UpstreamVersionOracle oracle,
                            ProbeScheduler probeScheduler,
                            StatsCollector statsCollector,
                            RetentionService retentionService,
                            ScannerProperties properties,
                            Clock clock) {
        this.registryService  = registryService;
        this.oracle           = oracle;
        this.probeScheduler   = probeScheduler;
        this.statsCollector   = statsCollector;
        this.retentionService = retentionService;
        this.properties       = properties;
        this.clock            = clock;
        this.scheduler        = Schedulers.parallel();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        startLoop("cleanup", properties.retention().cleanupInterval(), retentionService::cleanup, Duration.ZERO);

        if (!properties.isHealthChecksEnabled()) {
            log.error("Health checks are disabled by scanner.health-checks-enabled=false. Only cleanup runs.");
            return;
        }

        startLoop("registry", properties.registry().interval(), registryService::reconcile, Duration.ZERO);

        Duration upstreamInterval = properties.upstream().refreshInterval();
        Mono<Optional<Instant>> lastTick  = probeScheduler.lastTickTime().map(Optional::of)
            .defaultIfEmpty(Optional.empty());
        Mono<Optional<Instant>> lastStats = statsCollector.lastCollectionTime().map(Optional::of)
            .defaultIfEmpty(Optional.empty());

        oracle.refresh()
            .then(Mono.zip(lastTick, lastStats))
            .subscribe(
                t -> {
                    Instant now = clock.instant();
                    startLoop("upstream", upstreamInterval, oracle::refresh, upstreamInterval);
                    startLoop("probe", properties.probe().interval(), probeScheduler::runTick,
                              PeriodicLoop.initialDelay(t.getT1().orElse(null), properties.probe().interval(), now));
                    startLoop("stats", properties.stats().interval(), statsCollector::collectStats,
                              PeriodicLoop.initialDelay(t.getT2().orElse(null), properties.stats().interval(), now));
                },
                err -> {
                    log.error("Startup lookups failed, starting loops without resume delays", err);
                    startLoop("upstream", upstreamInterval, oracle::refresh, Duration.ZERO);
                    startLoop("probe", properties.probe().interval(), probeScheduler::runTick, Duration.ZERO);
                    startLoop("stats", properties.stats().interval(), statsCollector::collectStats, Duration.ZERO);
                });
    }

    @PreDestroy
    public void stop() {
        loops.forEach(PeriodicLoop::stop);
        loops.clear();
    }

    private void startLoop(String name, Duration interval, Supplier<Mono<?>> task, Duration initialDelay) {
        PeriodicLoop loop = new PeriodicLoop(name, interval, task, scheduler);
        loops.add(loop);
        loop.start(initialDelay);
    }
}
