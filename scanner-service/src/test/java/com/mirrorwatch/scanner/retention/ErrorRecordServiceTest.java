package com.mirrorwatch.scanner.retention;

import com.mirrorwatch.common.exception.ErrorCategory;
import com.mirrorwatch.common.model.ProbeError;
import com.mirrorwatch.scanner.TestSupport;
import com.mirrorwatch.scanner.model.ErrorRecord;
import com.mirrorwatch.scanner.repository.ErrorRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ErrorRecordServiceTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2024, 5, 1, 0, 0);

    private ErrorRecordRepository repository;
    private ErrorRecordService    service;

    @BeforeEach
    void setUp() {
        repository = mock(ErrorRecordRepository.class);
        service    = new ErrorRecordService(repository, TestSupport.defaults());
        when(repository.deleteAllById(anyIterable())).thenReturn(Mono.empty());
    }

    private static ErrorRecord stored(long id, int minutes) {
        ErrorRecord record = new ErrorRecord();
        record.setId(id);
        record.setInstanceId(7L);
        record.setOccurredAt(BASE.plusMinutes(minutes));
        return record;
    }

    @Test
    @DisplayName("records beyond the cap are evicted oldest first")
    void evictsOldest() {
        ErrorRecord[] rows = new ErrorRecord[102];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = stored(i + 1, i);
        }
        when(repository.findByInstanceId(7L)).thenReturn(Flux.just(rows));

        assertEquals(2, service.enforceCap(7L).block());
        verify(repository).deleteAllById(List.of(2L, 1L));
    }

    @Test
    @DisplayName("nothing is deleted at or below the cap")
    void withinCap() {
        when(repository.findByInstanceId(7L)).thenReturn(Flux.just(stored(1, 0), stored(2, 1)));

        assertEquals(0, service.enforceCap(7L).block());
        verify(repository, never()).deleteAllById(anyIterable());
    }

    @Test
    @DisplayName("record saves the error detail and enforces the cap")
    void record() {
        when(repository.save(any(ErrorRecord.class))).thenAnswer(inv -> {
            ErrorRecord saved = inv.getArgument(0);
            saved.setId(99L);
            return Mono.just(saved);
        });
        when(repository.findByInstanceId(7L)).thenReturn(Flux.empty());
        Instant at = Instant.parse("2024-05-01T12:00:00Z");

        ErrorRecord saved = service.record(7L, new ProbeError(ErrorCategory.BLOCKED, "blocked", 403, "<html/>", at)).block();

        assertEquals(99L, saved.getId());
        assertEquals("BLOCKED", saved.getCategory());
        assertEquals(403, saved.getHttpStatus());
        assertEquals("<html/>", saved.getHttpBody());
        assertEquals(LocalDateTime.of(2024, 5, 1, 12, 0), saved.getOccurredAt());
        verify(repository).findByInstanceId(7L);
    }
}
