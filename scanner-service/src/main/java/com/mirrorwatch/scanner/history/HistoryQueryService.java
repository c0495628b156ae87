package com.mirrorwatch.scanner.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.scanner.dto.CounterSummaryDTO;
import com.mirrorwatch.scanner.dto.HistoryPointDTO;
import com.mirrorwatch.scanner.dto.StatsPointDTO;
import com.mirrorwatch.scanner.exception.InstanceNotFoundException;
import com.mirrorwatch.scanner.exception.InvalidQueryException;
import com.mirrorwatch.scanner.model.Instance;
import com.mirrorwatch.scanner.model.StatsSnapshot;
import com.mirrorwatch.scanner.model.UtcTime;
import com.mirrorwatch.scanner.repository.HealthCheckRepository;
import com.mirrorwatch.scanner.repository.HistoryPoint;
import com.mirrorwatch.scanner.repository.InstanceRepository;
import com.mirrorwatch.scanner.repository.StatsSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Time series over stored checks and stats snapshots, for all instances or a single one.
 */
@Service
public class HistoryQueryService {

    private static final Logger log = LoggerFactory.getLogger(HistoryQueryService.class);

    private static final TypeReference<Map<String, Long>> COUNTERS = new TypeReference<>() {};

    private final HealthCheckRepository   healthCheckRepository;
    private final StatsSnapshotRepository snapshotRepository;
    private final InstanceRepository      instanceRepository;
    private final ObjectMapper            objectMapper;

    public HistoryQueryService(HealthCheckRepository healthCheckRepository,
                               StatsSnapshotRepository snapshotRepository,
                               InstanceRepository instanceRepository,
                               ObjectMapper objectMapper) {
        this.healthCheckRepository = healthCheckRepository;
        this.snapshotRepository    = snapshotRepository;
        this.instanceRepository    = instanceRepository;
        this.objectMapper          = objectMapper;
    }

    /** One point per tick in {@code [start, end]}; {@code domain} null means all instances. */
    public Flux<HistoryPointDTO> history(Instant start, Instant end, String domain) {
        return checkRange(start, end)
            .thenMany(Flux.defer(() -> {
                LocalDateTime from = UtcTime.toColumn(start);
                LocalDateTime to   = UtcTime.toColumn(end);
                if (domain == null) {
                    return healthCheckRepository.aggregateBetween(from, to);
                }
                return findInstance(domain)
                    .flatMapMany(i -> healthCheckRepository.aggregateBetweenForInstance(i.getId(), from, to));
            }))
            .map(HistoryQueryService::toDto);
    }

    /** One point per collection run in {@code [start, end]} with min, avg and max per counter. */
    public Flux<StatsPointDTO> stats(Instant start, Instant end, String domain) {
        return checkRange(start, end)
            .thenMany(Flux.defer(() -> {
                LocalDateTime from = UtcTime.toColumn(start);
                LocalDateTime to   = UtcTime.toColumn(end);
                if (domain == null) {
                    return snapshotRepository.findByCollectedAtBetweenOrderByCollectedAtAsc(from, to);
                }
                return findInstance(domain).flatMapMany(i -> snapshotRepository
                    .findByInstanceIdAndCollectedAtBetweenOrderByCollectedAtAsc(i.getId(), from, to));
            }))
            .bufferUntilChanged(StatsSnapshot::getCollectedAt)
            .map(this::summarise);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private static Mono<Void> checkRange(Instant start, Instant end) {
        if (start == null || end == null) {
            return Mono.error(new InvalidQueryException("start and end are required"));
        }
        if (start.isAfter(end)) {
            return Mono.error(new InvalidQueryException("start " + start + " is after end " + end));
        }
        return Mono.empty();
    }

    private Mono<Instance> findInstance(String domain) {
        return instanceRepository.findByDomain(domain)
            .switchIfEmpty(Mono.error(() -> new InstanceNotFoundException(domain)));
    }

    static HistoryPointDTO toDto(HistoryPoint point) {
        long healthy = point.healthy() == null ? 0 : point.healthy();
        long total   = point.total()   == null ? 0 : point.total();
        double pct   = total == 0 ? 0.0 : healthy * 100.0 / total;
        return new HistoryPointDTO(UtcTime.fromColumn(point.time()), healthy, total, pct, point.avgResponseMs());
    }

    StatsPointDTO summarise(List<StatsSnapshot> run) {
        Map<String, List<Long>> values = new TreeMap<>();
        for (StatsSnapshot snapshot : run) {
            for (Map.Entry<String, Long> e : readCounters(snapshot).entrySet()) {
                values.computeIfAbsent(e.getKey(), k -> new ArrayList<>()).add(e.getValue());
            }
        }
        Map<String, CounterSummaryDTO> counters = new LinkedHashMap<>();
        values.forEach((name, list) -> {
            long min = Long.MAX_VALUE;
            long max = Long.MIN_VALUE;
            long sum = 0;
            for (long v : list) {
                min = Math.min(min, v);
                max = Math.max(max, v);
                sum += v;
            }
            counters.put(name, new CounterSummaryDTO(min, (double) sum / list.size(), max));
        });
        return new StatsPointDTO(UtcTime.fromColumn(run.get(0).getCollectedAt()), run.size(), counters);
    }

    private Map<String, Long> readCounters(StatsSnapshot snapshot) {
        try {
            Map<String, Long> counters = objectMapper.readValue(snapshot.getCounters(), COUNTERS);
            return counters == null ? Map.of() : counters;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable stats snapshot skipped. id={} reason={}", snapshot.getId(), e.getOriginalMessage());
            return Map.of();
        }
    }
}
