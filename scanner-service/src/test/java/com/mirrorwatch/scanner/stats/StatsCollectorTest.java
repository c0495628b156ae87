package com.mirrorwatch.scanner.stats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.common.exception.ErrorCategory;
import com.mirrorwatch.common.exception.HttpStatusException;
import com.mirrorwatch.scanner.TestSupport;
import com.mirrorwatch.scanner.client.FetchResponse;
import com.mirrorwatch.scanner.client.InstanceHttpClient;
import com.mirrorwatch.scanner.model.Instance;
import com.mirrorwatch.scanner.model.InstanceOverride;
import com.mirrorwatch.scanner.model.InstanceOverrides;
import com.mirrorwatch.scanner.model.StatsSnapshot;
import com.mirrorwatch.scanner.repository.InstanceOverrideRepository;
import com.mirrorwatch.scanner.repository.InstanceRepository;
import com.mirrorwatch.scanner.repository.StatsSnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatsCollectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InstanceHttpClient         http;
    private InstanceRepository         instanceRepository;
    private InstanceOverrideRepository overrideRepository;
    private StatsSnapshotRepository    snapshotRepository;
    private StatsCollector             collector;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        http               = mock(InstanceHttpClient.class);
        instanceRepository = mock(InstanceRepository.class);
        overrideRepository = mock(InstanceOverrideRepository.class);
        snapshotRepository = mock(StatsSnapshotRepository.class);
        collector = new StatsCollector(http, instanceRepository, overrideRepository, snapshotRepository,
            objectMapper, TestSupport.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
        when(snapshotRepository.saveAll(anyIterable()))
            .thenAnswer(inv -> Flux.fromIterable((Iterable<StatsSnapshot>) inv.getArgument(0)));
    }

    private static InstanceOverride override(long instanceId, String key, String value) {
        InstanceOverride row = new InstanceOverride();
        row.setInstanceId(instanceId);
        row.setOverrideKey(key);
        row.setOverrideValue(value);
        return row;
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("integral counters are flattened and all snapshots share the run time")
    void collects() throws Exception {
        Instance a = TestSupport.instance(1L, "a.example");
        Instance b = TestSupport.instance(2L, "b.example");
        when(instanceRepository.findByEnabledTrue()).thenReturn(Flux.just(a, b));
        when(overrideRepository.findAll()).thenReturn(Flux.just(override(2L, "stats_bearer", "token")));
        when(http.fetch("https://a.example/.health", null))
            .thenReturn(Mono.just(new FetchResponse(200, TestSupport.fixture("health.json"), 10)));
        when(http.fetch("https://b.example/.health", "token"))
            .thenReturn(Mono.error(new HttpStatusException(ErrorCategory.HTTP_STATUS, 404, "Not Found", null)));

        assertEquals(1, collector.collectStats().block());

        ArgumentCaptor<Iterable<StatsSnapshot>> captor = ArgumentCaptor.forClass(Iterable.class);
        verify(snapshotRepository).saveAll(captor.capture());
        List<StatsSnapshot> saved = new ArrayList<>();
        captor.getValue().forEach(saved::add);
        assertEquals(1, saved.size());
        StatsSnapshot snapshot = saved.get(0);
        assertEquals(1L, snapshot.getInstanceId());
        assertEquals(LocalDateTime.of(2024, 5, 1, 12, 0), snapshot.getCollectedAt());
        Map<String, Object> counters = objectMapper.readValue(snapshot.getCounters(), Map.class);
        assertEquals(Map.of(
            "accounts.total", 12, "accounts.limited", 2,
            "requests.total", 9001, "requests.apis.search", 40, "requests.apis.tweet", 61), counters);
    }

    @Test
    @DisplayName("nothing is written when no instance publishes counters")
    void nothingCollected() {
        Instance a = TestSupport.instance(1L, "a.example");
        when(instanceRepository.findByEnabledTrue()).thenReturn(Flux.just(a));
        when(overrideRepository.findAll()).thenReturn(Flux.empty());
        when(http.fetch("https://a.example/.health", null))
            .thenReturn(Mono.just(new FetchResponse(200, "[1, 2, 3]", 10)));

        assertEquals(0, collector.collectStats().block());
        verify(snapshotRepository, never()).saveAll(anyIterable());
    }

    @Test
    @DisplayName("path and query overrides shape the stats URL")
    void statsUrl() {
        InstanceOverrides overrides = InstanceOverrides.of(List.of(
            override(1L, "stats_path", "internal/health"), override(1L, "stats_query", "key=abc")));

        assertEquals("https://a.example/.health", collector.statsUrl("https://a.example", InstanceOverrides.NONE));
        assertEquals("https://a.example/internal/health?key=abc", collector.statsUrl("https://a.example", overrides));
    }

    @Test
    @DisplayName("unparseable body is skipped without an error")
    void unparseableBody() {
        Instance a = TestSupport.instance(1L, "a.example");
        when(http.fetch("https://a.example/.health", null))
            .thenReturn(Mono.just(new FetchResponse(200, "<html>not json</html>", 10)));

        assertNull(collector.fetchSnapshot(a, InstanceOverrides.NONE, NOW).block());
    }
}
