package com.mirrorwatch.scanner.stats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.scanner.client.InstanceHttpClient;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.model.Instance;
import com.mirrorwatch.scanner.model.InstanceOverride;
import com.mirrorwatch.scanner.model.InstanceOverrides;
import com.mirrorwatch.scanner.model.OverrideKey;
import com.mirrorwatch.scanner.model.StatsSnapshot;
import com.mirrorwatch.scanner.model.UtcTime;
import com.mirrorwatch.scanner.repository.InstanceOverrideRepository;
import com.mirrorwatch.scanner.repository.InstanceRepository;
import com.mirrorwatch.scanner.repository.StatsSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collects the counters instances publish on their stats endpoint ({@code /.health} by default).
 *
 * <p>Per instance the path and query can be overridden and a bearer token supplied. A missing
 * endpoint or a body that is not a JSON object is logged at DEBUG and skipped. All snapshots of
 * one run share the run's timestamp and are written in a single batch.
 */
@Service
public class StatsCollector {

    private static final Logger log = LoggerFactory.getLogger(StatsCollector.class);

    private final InstanceHttpClient         httpClient;
    private final InstanceRepository         instanceRepository;
    private final InstanceOverrideRepository overrideRepository;
    private final StatsSnapshotRepository    snapshotRepository;
    private final ObjectMapper               objectMapper;
    private final ScannerProperties.Stats    config;
    private final Clock                      clock;

    public StatsCollector(InstanceHttpClient httpClient,
                          InstanceRepository instanceRepository,
                          InstanceOverrideRepository overrideRepository,
                          StatsSnapshotRepository snapshotRepository,
                          ObjectMapper objectMapper,
                          ScannerProperties properties,
                          Clock clock) {
        this.httpClient         = httpClient;
        this.instanceRepository = instanceRepository;
        this.overrideRepository = overrideRepository;
        this.snapshotRepository = snapshotRepository;
        this.objectMapper       = objectMapper;
        this.config             = properties.stats();
        this.clock              = clock;
    }

    /** @return number of snapshots written */
    public Mono<Integer> collectStats() {
        Instant collectedAt = clock.instant();
        Mono<Map<Long, List<InstanceOverride>>> overrides = overrideRepository.findAll()
            .collect(Collectors.groupingBy(InstanceOverride::getInstanceId));

        return Mono.zip(instanceRepository.findByEnabledTrue().collectList(), overrides)
            .flatMap(t -> Flux.fromIterable(t.getT1())
                .flatMap(instance -> fetchSnapshot(instance,
                            InstanceOverrides.of(t.getT2().get(instance.getId())), collectedAt),
                         config.concurrency())
                .collectList())
            .flatMap(snapshots -> snapshots.isEmpty()
                ? Mono.just(0)
                : snapshotRepository.saveAll(snapshots).count().map(Long::intValue))
            .doOnNext(count -> log.info("STATS_COLLECTED collectedAt={} snapshots={}", collectedAt, count));
    }

    public Mono<Instant> lastCollectionTime() {
        return snapshotRepository.findLatestCollectionTime().map(UtcTime::fromColumn);
    }

    Mono<StatsSnapshot> fetchSnapshot(Instance instance, InstanceOverrides overrides, Instant collectedAt) {
        String url = statsUrl(instance.getUrl(), overrides);
        return httpClient.fetch(url, overrides.get(OverrideKey.STATS_BEARER))
            .flatMap(response -> Mono.fromCallable(() -> toSnapshot(instance.getId(), response.body(), collectedAt)))
            .onErrorResume(e -> {
                log.debug("Stats fetch skipped. domain={} reason={}", instance.getDomain(), e.getMessage());
                return Mono.empty();
            });
    }

    String statsUrl(String baseUrl, InstanceOverrides overrides) {
        String path = overrides.getOrDefault(OverrideKey.STATS_PATH, config.path());
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        String query = overrides.get(OverrideKey.STATS_QUERY);
        return query == null ? baseUrl + path : baseUrl + path + "?" + query;
    }

    private StatsSnapshot toSnapshot(long instanceId, String body, Instant collectedAt) throws JsonProcessingException {
        Map<String, Long> counters = CounterFlattener.flatten(objectMapper.readTree(body));
        if (counters.isEmpty()) {
            throw new IllegalStateException("Stats body holds no counters");
        }
        StatsSnapshot snapshot = new StatsSnapshot();
        snapshot.setInstanceId(instanceId);
        snapshot.setCollectedAt(UtcTime.toColumn(collectedAt));
        snapshot.setCounters(objectMapper.writeValueAsString(counters));
        return snapshot;
    }
}
