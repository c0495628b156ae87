package com.mirrorwatch.scanner.scheduler;

import com.mirrorwatch.common.model.ProbeError;
import com.mirrorwatch.common.model.ProbeResult;
import com.mirrorwatch.scanner.model.HealthCheckRecord;
import com.mirrorwatch.scanner.probe.ProbeOutcome;
import com.mirrorwatch.scanner.repository.HealthCheckRepository;
import com.mirrorwatch.scanner.retention.ErrorRecordService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Persists the outcomes of one tick: one health check row per instance, plus one error record
 * per unhealthy result of a host that is not muted.
 */
@Component
public class ProbeResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ProbeResultWriter.class);

    private final HealthCheckRepository healthCheckRepository;
    private final ErrorRecordService    errorRecordService;

    public ProbeResultWriter(HealthCheckRepository healthCheckRepository,
                             ErrorRecordService errorRecordService) {
        this.healthCheckRepository = healthCheckRepository;
        this.errorRecordService    = errorRecordService;
    }

    public Mono<TickSummary> write(Instant tickTime, int dispatched, List<ProbeOutcome> outcomes,
                                   Set<Long> mutedInstanceIds) {
        List<ProbeResult> results = outcomes.stream()
            .map(outcome -> toResult(outcome, tickTime))
            .toList();
        int crashed   = (int) outcomes.stream().filter(o -> o instanceof ProbeOutcome.Crashed).count();
        int healthy   = (int) results.stream().filter(ProbeResult::healthy).count();
        List<ProbeResult> failures = results.stream().filter(r -> !r.healthy()).toList();
        int muted     = (int) failures.stream().filter(r -> mutedInstanceIds.contains(r.instanceId())).count();

        Mono<Void> checks = healthCheckRepository
            .saveAll(results.stream().map(HealthCheckRecord::from).toList())
            .then();

        Mono<Void> errors = Flux.fromIterable(failures)
            .filter(r -> {
                if (mutedInstanceIds.contains(r.instanceId())) {
                    log.debug("Muted host failure. instanceId={} category={} message={}",
                              r.instanceId(), r.error().category(), r.error().message());
                    return false;
                }
                return true;
            })
            .concatMap(r -> errorRecordService.record(r.instanceId(), r.error())
                .onErrorResume(e -> {
                    log.warn("Failed to store error record. instanceId={}", r.instanceId(), e);
                    return Mono.empty();
                }))
            .then();

        return checks
            .then(errors)
            .then(Mono.fromSupplier(() -> new TickSummary(
                tickTime, dispatched, results.size(), healthy, failures.size(), crashed, muted)));
    }

    static ProbeResult toResult(ProbeOutcome outcome, Instant tickTime) {
        if (outcome instanceof ProbeOutcome.Completed completed) {
            return completed.result();
        }
        ProbeOutcome.Crashed crashed = (ProbeOutcome.Crashed) outcome;
        return ProbeResult.failed(crashed.instanceId(), tickTime,
            ProbeError.of(crashed.category(), crashed.message(), tickTime));
    }
}
