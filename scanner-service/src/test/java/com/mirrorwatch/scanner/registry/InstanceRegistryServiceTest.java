package com.mirrorwatch.scanner.registry;

import com.mirrorwatch.common.exception.MarkupParseException;
import com.mirrorwatch.common.exception.RegistryFetchException;
import com.mirrorwatch.common.exception.TransientNetworkException;
import com.mirrorwatch.scanner.TestSupport;
import com.mirrorwatch.scanner.client.FetchResponse;
import com.mirrorwatch.scanner.client.InstanceHttpClient;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.model.Instance;
import com.mirrorwatch.scanner.repository.InstanceRepository;
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
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InstanceRegistryServiceTest {

    private static final String        LIST_URL = "https://github.com/zedeus/nitter/wiki/Instances";
    private static final Instant       NOW      = Instant.parse("2024-05-01T12:00:00Z");
    private static final LocalDateTime NOW_COL  = LocalDateTime.of(2024, 5, 1, 12, 0);

    private InstanceHttpClient http;
    private InstanceRepository repository;

    @BeforeEach
    void setUp() {
        http       = mock(InstanceHttpClient.class);
        repository = mock(InstanceRepository.class);
        when(http.fetch(LIST_URL)).thenReturn(Mono.just(
            new FetchResponse(200, TestSupport.fixture("instance-list.html"), 300)));
        when(repository.save(any(Instance.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
    }

    private InstanceRegistryService service(ScannerProperties properties) {
        return new InstanceRegistryService(http, repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Instance stored(long id, String domain, String country) {
        Instance row = TestSupport.instance(id, domain);
        row.setCountry(country);
        row.setListedSince(NOW_COL.minusDays(10));
        return row;
    }

    private Map<String, Instance> savedByDomain(int expected) {
        ArgumentCaptor<Instance> saved = ArgumentCaptor.forClass(Instance.class);
        verify(repository, times(expected)).save(saved.capture());
        return saved.getAllValues().stream().collect(Collectors.toMap(Instance::getDomain, Function.identity()));
    }

    @Test
    @DisplayName("new hosts are inserted, unchanged hosts are not written, absent hosts go stale")
    void reconcile() {
        when(repository.findAll()).thenReturn(Flux.just(
            stored(1L, "mirror.example.net", "🇨🇭"),
            stored(2L, "stale.example", "🇩🇪")));

        ReconciliationResult result = service(TestSupport.defaults()).reconcile().block();

        assertEquals(List.of("other.example.org"), result.added());
        assertEquals(List.of("mirror.example.net"), result.retained());
        assertEquals(List.of("stale.example"), result.removedCandidates());
        assertTrue(result.retired().isEmpty());

        Map<String, Instance> saved = savedByDomain(2);
        Instance added = saved.get("other.example.org");
        assertNull(added.getId());
        assertTrue(added.isEnabled());
        assertEquals("🇫🇷", added.getCountry());
        assertEquals(NOW_COL, added.getListedSince());

        Instance stale = saved.get("stale.example");
        assertTrue(stale.isEnabled());
        assertEquals(1, stale.getMissedPasses());
        assertFalse(saved.containsKey("mirror.example.net"));
    }

    @Test
    @DisplayName("host listed again after missing restarts its listing streak")
    void relisted() {
        Instance missing = stored(1L, "mirror.example.net", "🇨🇭");
        missing.setMissedPasses(3);
        when(repository.findAll()).thenReturn(Flux.just(missing, stored(3L, "other.example.org", "🇫🇷")));

        service(TestSupport.defaults()).reconcile().block();

        Instance saved = savedByDomain(1).get("mirror.example.net");
        assertEquals(0, saved.getMissedPasses());
        assertEquals(NOW_COL, saved.getListedSince());
    }

    @Test
    @DisplayName("absent host is disabled once the miss limit is reached")
    void retires() {
        Instance stale = stored(2L, "stale.example", "🇩🇪");
        stale.setMissedPasses(1);
        when(repository.findAll()).thenReturn(Flux.just(
            stored(1L, "mirror.example.net", "🇨🇭"), stored(3L, "other.example.org", "🇫🇷"), stale));
        ScannerProperties props = TestSupport.withRegistry(
            new ScannerProperties.Registry(null, null, null, null, null, 2));

        ReconciliationResult result = service(props).reconcile().block();

        assertEquals(List.of("stale.example"), result.retired());
        Instance saved = savedByDomain(1).get("stale.example");
        assertFalse(saved.isEnabled());
        assertEquals(2, saved.getMissedPasses());
    }

    @Test
    @DisplayName("configured bad host is flagged and additional hosts are inserted")
    void configuredHosts() {
        when(repository.findAll()).thenReturn(Flux.empty());
        ScannerProperties props = TestSupport.withRegistry(new ScannerProperties.Registry(
            null, null, List.of("https://extra.example"), "🇺🇳", List.of("other.example.org"), null));

        ReconciliationResult result = service(props).reconcile().block();

        assertEquals(3, result.added().size());
        Map<String, Instance> saved = savedByDomain(3);
        assertTrue(saved.get("other.example.org").isBadHost());
        assertTrue(saved.get("extra.example").isAdditional());
        assertEquals("🇺🇳", saved.get("extra.example").getCountry());
    }

    @Test
    @DisplayName("fetch failure is a registry fetch error and writes nothing")
    void fetchFailure() {
        when(http.fetch(LIST_URL)).thenReturn(Mono.error(new TransientNetworkException("reset", null)));

        assertThrows(RegistryFetchException.class, () -> service(TestSupport.defaults()).reconcile().block());
        verify(repository, never()).save(any(Instance.class));
    }

    @Test
    @DisplayName("page without the instance table is a parse error and writes nothing")
    void parseFailure() {
        when(http.fetch(LIST_URL)).thenReturn(Mono.just(new FetchResponse(200, "<html><body></body></html>", 5)));
        when(repository.findAll()).thenReturn(Flux.empty());

        assertThrows(MarkupParseException.class, () -> service(TestSupport.defaults()).reconcile().block());
        verify(repository, never()).save(any(Instance.class));
    }
}
