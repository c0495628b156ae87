package com.mirrorwatch.scanner.scoring;

import com.mirrorwatch.common.model.VersionFreshness;
import com.mirrorwatch.common.scoring.InstanceScore;
import com.mirrorwatch.common.scoring.InstanceScoreCalculator;
import com.mirrorwatch.common.scoring.ScoreInputs;
import com.mirrorwatch.common.scoring.WindowStats;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.model.HealthCheckRecord;
import com.mirrorwatch.scanner.model.Instance;
import com.mirrorwatch.scanner.model.UtcTime;
import com.mirrorwatch.scanner.repository.HealthCheckRepository;
import com.mirrorwatch.scanner.repository.LastHealthy;
import com.mirrorwatch.scanner.repository.WindowCount;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads check history from the store and scores instances with {@link InstanceScoreCalculator}.
 */
@Service
public class ScoringService {

    static final Duration WINDOW_3H   = Duration.ofHours(3);
    static final Duration WINDOW_30D  = Duration.ofDays(30);
    static final Duration WINDOW_120D = Duration.ofDays(120);

    private final HealthCheckRepository healthCheckRepository;
    private final Duration              pingRange;
    private final Clock                 clock;

    public ScoringService(HealthCheckRepository healthCheckRepository,
                          ScannerProperties properties,
                          Clock clock) {
        this.healthCheckRepository = healthCheckRepository;
        this.pingRange             = properties.scoring().pingRange();
        this.clock                 = clock;
    }

    public Mono<InstanceScore> score(Instance instance) {
        return loadContext().map(ctx -> compute(ctx, instance));
    }

    public Mono<ScoringContext> loadContext() {
        Instant now = clock.instant();
        Mono<Map<Long, WindowCount>> last3h   = counts(now.minus(WINDOW_3H));
        Mono<Map<Long, WindowCount>> last30d  = counts(now.minus(WINDOW_30D));
        Mono<Map<Long, WindowCount>> last120d = counts(now.minus(WINDOW_120D));
        Mono<Map<Long, WindowCount>> overall  = healthCheckRepository.countAll()
            .collectMap(WindowCount::instanceId);
        Mono<Map<Long, LocalDateTime>> lastHealthy = healthCheckRepository.findLastHealthyPerInstance()
            .collectMap(LastHealthy::instanceId, LastHealthy::lastHealthyAt);
        Mono<Map<Long, List<Integer>>> responseTimes = healthCheckRepository
            .findHealthySince(UtcTime.toColumn(now.minus(pingRange)))
            .collect(Collectors.groupingBy(HealthCheckRecord::getInstanceId,
                     Collectors.mapping(HealthCheckRecord::getResponseTimeMs, Collectors.toList())));
        Mono<Map<Long, HealthCheckRecord>> latest = healthCheckRepository.findLatestPerInstance()
            .collectMap(HealthCheckRecord::getInstanceId);

        return Mono.zip(last3h, last30d, last120d, overall, lastHealthy, responseTimes, latest)
            .map(t -> new ScoringContext(now, t.getT1(), t.getT2(), t.getT3(), t.getT4(),
                                         t.getT5(), t.getT6(), t.getT7()));
    }

    public InstanceScore compute(ScoringContext ctx, Instance instance) {
        Long id = instance.getId();
        HealthCheckRecord latest = ctx.latest().get(id);
        VersionFreshness freshness = latest == null
            ? VersionFreshness.MISSING
            : VersionFreshness.of(latest.getVersionName(), latest.isUpstream(), latest.isLatestVersion());

        ScoreInputs inputs = new ScoreInputs(
            latest != null && latest.isHealthy(),
            window(ctx.last3h().get(id)),
            window(ctx.last30d().get(id)),
            window(ctx.last120d().get(id)),
            ctx.healthyResponseTimes().getOrDefault(id, List.of()),
            freshness,
            instance.isBadHost());
        return InstanceScoreCalculator.compute(inputs);
    }

    static WindowStats window(WindowCount count) {
        if (count == null) {
            return WindowStats.EMPTY;
        }
        return new WindowStats(nullToZero(count.healthy()), nullToZero(count.total()));
    }

    private Mono<Map<Long, WindowCount>> counts(Instant since) {
        return healthCheckRepository.countSince(UtcTime.toColumn(since))
            .collectMap(WindowCount::instanceId);
    }

    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }
}
