package com.mirrorwatch.scanner.scheduler;

import com.mirrorwatch.common.exception.ErrorCategory;
import com.mirrorwatch.common.model.Connectivity;
import com.mirrorwatch.common.model.ProbeError;
import com.mirrorwatch.common.model.ProbeResult;
import com.mirrorwatch.scanner.model.ErrorRecord;
import com.mirrorwatch.scanner.model.HealthCheckRecord;
import com.mirrorwatch.scanner.probe.ProbeOutcome;
import com.mirrorwatch.scanner.repository.HealthCheckRepository;
import com.mirrorwatch.scanner.retention.ErrorRecordService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProbeResultWriterTest {

    private static final Instant TICK = Instant.parse("2024-05-01T12:00:00Z");

    private HealthCheckRepository healthCheckRepository;
    private ErrorRecordService    errorRecordService;
    private ProbeResultWriter     writer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        healthCheckRepository = mock(HealthCheckRepository.class);
        errorRecordService    = mock(ErrorRecordService.class);
        writer = new ProbeResultWriter(healthCheckRepository, errorRecordService);
        when(healthCheckRepository.saveAll(anyIterable()))
            .thenAnswer(inv -> Flux.fromIterable((Iterable<HealthCheckRecord>) inv.getArgument(0)));
        when(errorRecordService.record(anyLong(), any(ProbeError.class)))
            .thenReturn(Mono.just(new ErrorRecord()));
    }

    private static ProbeOutcome healthy(long id) {
        return new ProbeOutcome.Completed(new ProbeResult(id, TICK, true, 100, 200,
            null, null, false, false, true, Connectivity.IPV4, null));
    }

    private static ProbeOutcome failed(long id) {
        return new ProbeOutcome.Completed(ProbeResult.failed(id, TICK,
            ProbeError.of(ErrorCategory.TIMEOUT, "Request timed out", TICK)));
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("one row per outcome, error records only for unmuted failures")
    void writesRowsAndErrors() {
        List<ProbeOutcome> outcomes = List.of(healthy(1), failed(2), failed(3),
            new ProbeOutcome.Crashed(4, ErrorCategory.INTERNAL, "Probe crashed: boom"));

        TickSummary summary = writer.write(TICK, 5, outcomes, Set.of(3L)).block();

        assertEquals(5, summary.dispatched());
        assertEquals(4, summary.written());
        assertEquals(1, summary.healthy());
        assertEquals(3, summary.unhealthy());
        assertEquals(1, summary.crashed());
        assertEquals(1, summary.muted());

        ArgumentCaptor<Iterable<HealthCheckRecord>> rows = ArgumentCaptor.forClass(Iterable.class);
        verify(healthCheckRepository).saveAll(rows.capture());
        List<HealthCheckRecord> saved = new ArrayList<>();
        rows.getValue().forEach(saved::add);
        assertEquals(4, saved.size());
        HealthCheckRecord crashed = saved.get(3);
        assertFalse(crashed.isHealthy());
        assertEquals("INTERNAL", crashed.getErrorCategory());

        verify(errorRecordService).record(eq(2L), any(ProbeError.class));
        verify(errorRecordService).record(eq(4L), any(ProbeError.class));
        verify(errorRecordService, never()).record(eq(3L), any(ProbeError.class));
        verify(errorRecordService, never()).record(eq(1L), any(ProbeError.class));
    }

    @Test
    @DisplayName("failing error record write does not fail the tick")
    void errorRecordFailureAbsorbed() {
        when(errorRecordService.record(anyLong(), any(ProbeError.class)))
            .thenReturn(Mono.error(new IllegalStateException("db down")));

        TickSummary summary = writer.write(TICK, 1, List.of(failed(2)), Set.of()).block();

        assertEquals(1, summary.unhealthy());
    }
}
