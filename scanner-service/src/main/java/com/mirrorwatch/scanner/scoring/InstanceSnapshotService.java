package com.mirrorwatch.scanner.scoring;

import com.mirrorwatch.common.model.Connectivity;
import com.mirrorwatch.common.scoring.InstanceScore;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.dto.ErrorRecordDTO;
import com.mirrorwatch.scanner.dto.InstanceSnapshotDTO;
import com.mirrorwatch.scanner.dto.RecentCheckDTO;
import com.mirrorwatch.scanner.exception.InstanceNotFoundException;
import com.mirrorwatch.scanner.model.HealthCheckRecord;
import com.mirrorwatch.scanner.model.Instance;
import com.mirrorwatch.scanner.model.UtcTime;
import com.mirrorwatch.scanner.repository.ErrorRecordRepository;
import com.mirrorwatch.scanner.repository.HealthCheckRepository;
import com.mirrorwatch.scanner.repository.InstanceRepository;
import com.mirrorwatch.scanner.repository.WindowCount;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the per-instance status view and its ranking.
 *
 * <p><b>Ranking</b>:
 * <pre>
 *   ranked hosts before unranked (bad hosts)
 *   points desc, ties by overall healthy percentage desc
 *   hosts with zero points by last healthy time desc, never-healthy last
 *   domain asc as final tie breaker
 * </pre>
 */
@Service
public class InstanceSnapshotService {

    static final Duration LAST_SEEN_THRESHOLD = Duration.ofHours(12);

    static final Comparator<InstanceSnapshotDTO> RANKING = InstanceSnapshotService::compare;

    private final InstanceRepository    instanceRepository;
    private final HealthCheckRepository healthCheckRepository;
    private final ErrorRecordRepository errorRecordRepository;
    private final ScoringService        scoringService;
    private final int                   recentChecks;

    public InstanceSnapshotService(InstanceRepository instanceRepository,
                                   HealthCheckRepository healthCheckRepository,
                                   ErrorRecordRepository errorRecordRepository,
                                   ScoringService scoringService,
                                   ScannerProperties properties) {
        this.instanceRepository    = instanceRepository;
        this.healthCheckRepository = healthCheckRepository;
        this.errorRecordRepository = errorRecordRepository;
        this.scoringService        = scoringService;
        this.recentChecks          = properties.scoring().recentChecks();
    }

    /** Enabled instances, ranked. */
    public Mono<List<InstanceSnapshotDTO>> snapshots() {
        return scoringService.loadContext()
            .flatMap(ctx -> instanceRepository.findByEnabledTrue()
                .concatMap(instance -> build(ctx, instance))
                .sort(RANKING)
                .collectList());
    }

    public Mono<InstanceSnapshotDTO> snapshot(String domain) {
        return findInstance(domain)
            .flatMap(instance -> scoringService.loadContext().flatMap(ctx -> build(ctx, instance)));
    }

    public Flux<ErrorRecordDTO> errors(String domain, int limit) {
        return findInstance(domain)
            .flatMapMany(instance -> errorRecordRepository.findNewest(instance.getId(), limit))
            .map(r -> new ErrorRecordDTO(UtcTime.fromColumn(r.getOccurredAt()), r.getCategory(),
                                         r.getMessage(), r.getHttpStatus(), r.getHttpBody()));
    }

    private Mono<Instance> findInstance(String domain) {
        return instanceRepository.findByDomain(domain)
            .switchIfEmpty(Mono.error(() -> new InstanceNotFoundException(domain)));
    }

    // ── assembly ──────────────────────────────────────────────────────────────

    private Mono<InstanceSnapshotDTO> build(ScoringContext ctx, Instance instance) {
        return healthCheckRepository.findRecent(instance.getId(), recentChecks)
            .map(c -> new RecentCheckDTO(UtcTime.fromColumn(c.getCheckedAt()), c.isHealthy(),
                                         c.getResponseTimeMs(), c.getHttpStatus()))
            .collectList()
            .map(recent -> assemble(ctx, instance, recent));
    }

    InstanceSnapshotDTO assemble(ScoringContext ctx, Instance instance, List<RecentCheckDTO> recent) {
        Long id = instance.getId();
        InstanceScore score = scoringService.compute(ctx, instance);
        HealthCheckRecord latest = ctx.latest().get(id);
        Instant lastHealthy = UtcTime.fromColumn(ctx.lastHealthy().get(id));
        WindowCount overall = ctx.overall().get(id);
        Double overallPct = ScoringService.window(overall).percentage();
        boolean showLastSeen = lastHealthy == null
            || lastHealthy.isBefore(ctx.now().minus(LAST_SEEN_THRESHOLD));

        return new InstanceSnapshotDTO(
            instance.getDomain(), instance.getUrl(), instance.getCountry(),
            instance.isAdditional(), instance.isBadHost(), instance.getMissedPasses() > 0,
            score, overallPct, lastHealthy, showLastSeen,
            latest == null ? null : UtcTime.fromColumn(latest.getCheckedAt()),
            latest != null && latest.isRss(),
            latest == null ? null : latest.getVersionName(),
            latest == null ? null : latest.getVersionUrl(),
            latest != null && latest.isUpstream(),
            latest != null && latest.isLatestVersion(),
            latest == null ? Connectivity.UNKNOWN : latest.connectivityValue(),
            recent);
    }

    static int compare(InstanceSnapshotDTO a, InstanceSnapshotDTO b) {
        if (a.score().ranked() != b.score().ranked()) {
            return a.score().ranked() ? -1 : 1;
        }
        int pa = a.score().points();
        int pb = b.score().points();
        if (pa == 0 && pb == 0) {
            int byLastHealthy = Comparator.nullsLast(Comparator.<Instant>reverseOrder())
                .compare(a.lastHealthyAt(), b.lastHealthyAt());
            return byLastHealthy != 0 ? byLastHealthy : a.domain().compareTo(b.domain());
        }
        if (pa != pb) {
            return Integer.compare(pb, pa);
        }
        int byOverall = Comparator.nullsLast(Comparator.<Double>reverseOrder())
            .compare(a.overallPct(), b.overallPct());
        return byOverall != 0 ? byOverall : a.domain().compareTo(b.domain());
    }
}
