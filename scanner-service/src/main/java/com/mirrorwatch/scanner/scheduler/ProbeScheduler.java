package com.mirrorwatch.scanner.scheduler;

import com.mirrorwatch.common.exception.ErrorCategory;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.model.HealthCheckRecord;
import com.mirrorwatch.scanner.model.Instance;
import com.mirrorwatch.scanner.model.InstanceOverride;
import com.mirrorwatch.scanner.model.InstanceOverrides;
import com.mirrorwatch.scanner.model.UtcTime;
import com.mirrorwatch.scanner.probe.HealthProber;
import com.mirrorwatch.scanner.probe.ProbeOutcome;
import com.mirrorwatch.scanner.repository.HealthCheckRepository;
import com.mirrorwatch.scanner.repository.InstanceOverrideRepository;
import com.mirrorwatch.scanner.repository.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One probe tick over all enabled instances.
 *
 * <pre>
 *   load instances, latest checks, overrides
 *     → flatMap(probe, concurrency) until the tick deadline
 *     → one health check row per probed instance, error records for unmuted failures
 * </pre>
 *
 * <p>A host is muted when auto-mute is on and its previous check was unhealthy or it is a
 * bad host; muting only suppresses the error record, the health result is stored as usual.
 */
@Service
public class ProbeScheduler {

    private static final Logger log = LoggerFactory.getLogger(ProbeScheduler.class);

    private final InstanceRepository         instanceRepository;
    private final HealthCheckRepository      healthCheckRepository;
    private final InstanceOverrideRepository overrideRepository;
    private final HealthProber               prober;
    private final ProbeResultWriter          writer;
    private final ScannerProperties          properties;
    private final Clock                      clock;

    public ProbeScheduler(InstanceRepository instanceRepository,
                          HealthCheckRepository healthCheckRepository,
                          InstanceOverrideRepository overrideRepository,
                          HealthProber prober,
                          ProbeResultWriter writer,
                          ScannerProperties properties,
                          Clock clock) {
        this.instanceRepository    = instanceRepository;
        this.healthCheckRepository = healthCheckRepository;
        this.overrideRepository    = overrideRepository;
        this.prober                = prober;
        this.writer                = writer;
        this.properties            = properties;
        this.clock                 = clock;
    }

    public Mono<TickSummary> runTick() {
        Instant tickTime = clock.instant();
        ScannerProperties.Probe probe = properties.probe();

        Mono<List<Instance>> instances = instanceRepository.findByEnabledTrue()
            .filter(i -> !(probe.skipBadHosts() && i.isBadHost()))
            .collectList();
        Mono<Map<Long, Boolean>> lastHealthy = healthCheckRepository.findLatestPerInstance()
            .collectMap(HealthCheckRecord::getInstanceId, HealthCheckRecord::isHealthy);
        Mono<Map<Long, List<InstanceOverride>>> overrides = overrideRepository.findAll()
            .collect(Collectors.groupingBy(InstanceOverride::getInstanceId));

        return Mono.zip(instances, lastHealthy, overrides)
            .flatMap(t -> {
                List<Instance> targets = t.getT1();
                Set<Long> muted = mutedInstances(targets, t.getT2());
                log.info("PROBE_TICK_STARTED tickTime={} instances={} muted={}", tickTime, targets.size(), muted.size());

                return Flux.fromIterable(targets)
                    .flatMap(i -> probeOne(i, InstanceOverrides.of(t.getT3().get(i.getId())), tickTime),
                             probe.concurrency())
                    .take(probe.tickDeadline())
                    .collectList()
                    .flatMap(outcomes -> {
                        if (outcomes.size() < targets.size()) {
                            log.warn("Tick deadline reached, remaining probes dropped. tickTime={} probed={} instances={}",
                                     tickTime, outcomes.size(), targets.size());
                        }
                        return writer.write(tickTime, targets.size(), outcomes, muted);
                    });
            })
            .doOnNext(s -> log.info(
                "PROBE_TICK_COMPLETE tickTime={} dispatched={} written={} healthy={} unhealthy={} crashed={} muted={}",
                s.tickTime(), s.dispatched(), s.written(), s.healthy(), s.unhealthy(), s.crashed(), s.muted()));
    }

    /** Latest time a tick was stored, for delaying the first tick after a restart. */
    public Mono<Instant> lastTickTime() {
        return healthCheckRepository.findLatestCheckTime()
            .map(UtcTime::fromColumn);
    }

    private Mono<ProbeOutcome> probeOne(Instance instance, InstanceOverrides overrides, Instant tickTime) {
        return Mono.defer(() -> prober.probe(instance, overrides, tickTime))
            .<ProbeOutcome>map(ProbeOutcome.Completed::new)
            .switchIfEmpty(Mono.fromSupplier(() -> new ProbeOutcome.Crashed(
                instance.getId(), ErrorCategory.INTERNAL, "Probe produced no result")))
            .onErrorResume(e -> {
                log.error("Probe crashed. domain={}", instance.getDomain(), e);
                return Mono.just(new ProbeOutcome.Crashed(
                    instance.getId(), ErrorCategory.INTERNAL, "Probe crashed: " + e.getMessage()));
            });
    }

    Set<Long> mutedInstances(List<Instance> instances, Map<Long, Boolean> lastHealthy) {
        Set<Long> muted = new HashSet<>();
        if (!properties.retention().autoMute()) {
            return muted;
        }
        for (Instance instance : instances) {
            boolean lastCheckFailed = Boolean.FALSE.equals(lastHealthy.get(instance.getId()));
            if (lastCheckFailed || instance.isBadHost()) {
                muted.add(instance.getId());
            }
        }
        return muted;
    }
}
