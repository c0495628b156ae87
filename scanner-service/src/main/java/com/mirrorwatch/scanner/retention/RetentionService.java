package com.mirrorwatch.scanner.retention;

import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.model.UtcTime;
import com.mirrorwatch.scanner.repository.ErrorRecordRepository;
import com.mirrorwatch.scanner.repository.HealthCheckRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Periodic cleanup: error records beyond the per-instance cap and, when a horizon is
 * configured, health checks older than it.
 */
@Service
public class RetentionService {

    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final ErrorRecordRepository errorRecordRepository;
    private final HealthCheckRepository healthCheckRepository;
    private final ErrorRecordService    errorRecordService;
    private final Duration              healthHorizon;
    private final Clock                 clock;

    public RetentionService(ErrorRecordRepository errorRecordRepository,
                            HealthCheckRepository healthCheckRepository,
                            ErrorRecordService errorRecordService,
                            ScannerProperties properties,
                            Clock clock) {
        this.errorRecordRepository = errorRecordRepository;
        this.healthCheckRepository = healthCheckRepository;
        this.errorRecordService    = errorRecordService;
        this.healthHorizon         = properties.retention().healthHorizon();
        this.clock                 = clock;
    }

    public Mono<CleanupSummary> cleanup() {
        Mono<Integer> errors = errorRecordRepository.findInstanceIds()
            .concatMap(errorRecordService::enforceCap)
            .reduce(0, Integer::sum);

        Mono<Integer> checks = healthHorizon == null
            ? Mono.just(0)
            : healthCheckRepository.deleteOlderThan(UtcTime.toColumn(clock.instant().minus(healthHorizon)));

        return errors.zipWith(checks, CleanupSummary::new)
            .doOnNext(s -> log.info("CLEANUP_COMPLETE errorRecordsEvicted={} healthChecksDeleted={}",
                                    s.errorRecordsEvicted(), s.healthChecksDeleted()));
    }
}
