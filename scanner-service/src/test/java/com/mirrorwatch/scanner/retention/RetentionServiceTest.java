package com.mirrorwatch.scanner.retention;

import com.mirrorwatch.scanner.TestSupport;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.repository.ErrorRecordRepository;
import com.mirrorwatch.scanner.repository.HealthCheckRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetentionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private ErrorRecordRepository errorRecordRepository;
    private HealthCheckRepository healthCheckRepository;
    private ErrorRecordService    errorRecordService;

    @BeforeEach
    void setUp() {
        errorRecordRepository = mock(ErrorRecordRepository.class);
        healthCheckRepository = mock(HealthCheckRepository.class);
        errorRecordService    = mock(ErrorRecordService.class);
        when(errorRecordRepository.findInstanceIds()).thenReturn(Flux.just(1L, 2L));
        when(errorRecordService.enforceCap(1L)).thenReturn(Mono.just(3));
        when(errorRecordService.enforceCap(2L)).thenReturn(Mono.just(0));
    }

    private RetentionService service(ScannerProperties properties) {
        return new RetentionService(errorRecordRepository, healthCheckRepository, errorRecordService,
            properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("without a horizon health checks are kept forever")
    void noHorizon() {
        CleanupSummary summary = service(TestSupport.defaults()).cleanup().block();

        assertEquals(3, summary.errorRecordsEvicted());
        assertEquals(0, summary.healthChecksDeleted());
        verify(healthCheckRepository, never()).deleteOlderThan(any(LocalDateTime.class));
    }

    @Test
    @DisplayName("checks older than the horizon are deleted")
    void withHorizon() {
        ScannerProperties props = TestSupport.withRetention(
            new ScannerProperties.Retention(null, null, Duration.ofDays(180), null));
        LocalDateTime cutoff = LocalDateTime.ofInstant(NOW.minus(Duration.ofDays(180)), ZoneOffset.UTC);
        when(healthCheckRepository.deleteOlderThan(cutoff)).thenReturn(Mono.just(42));

        CleanupSummary summary = service(props).cleanup().block();

        assertEquals(42, summary.healthChecksDeleted());
        verify(healthCheckRepository).deleteOlderThan(cutoff);
    }
}
