package com.mirrorwatch.scanner.probe;

import com.mirrorwatch.common.exception.TransientNetworkException;
import com.mirrorwatch.common.model.Connectivity;
import com.mirrorwatch.scanner.TestSupport;
import com.mirrorwatch.scanner.client.FetchResponse;
import com.mirrorwatch.scanner.client.InstanceHttpClient;
import com.mirrorwatch.scanner.config.ScannerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.net.InetAddress;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConnectivityClassifierTest {

    private final InstanceHttpClient http = mock(InstanceHttpClient.class);

    private static InetAddress address(byte... bytes) {
        try {
            return InetAddress.getByAddress("mirror.example.net", bytes);
        } catch (UnknownHostException e) {
            throw new IllegalStateException(e);
        }
    }

    private static final InetAddress V4 = address(new byte[] {10, 0, 0, 1});
    private static final InetAddress V6 = address(new byte[] {0x20, 0x01, 0x0d, (byte) 0xb8, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1});

    @Test
    @DisplayName("A and AAAA records mean dual stack")
    void dualStack() {
        ConnectivityClassifier classifier = new ConnectivityClassifier(http, TestSupport.defaults(),
            host -> new InetAddress[] {V4, V6});

        assertEquals(Connectivity.ALL, classifier.classify("mirror.example.net", "https://mirror.example.net").block());
    }

    @Test
    @DisplayName("only A records mean IPv4")
    void ipv4Only() {
        ConnectivityClassifier classifier = new ConnectivityClassifier(http, TestSupport.defaults(),
            host -> new InetAddress[] {V4});

        assertEquals(Connectivity.IPV4, classifier.classify("mirror.example.net", "https://mirror.example.net").block());
    }

    @Test
    @DisplayName("resolution failure is UNKNOWN, never an error")
    void unresolvable() {
        ConnectivityClassifier classifier = new ConnectivityClassifier(http, TestSupport.defaults(), host -> {
            throw new UnknownHostException(host);
        });

        assertEquals(Connectivity.UNKNOWN, classifier.classify("gone.example", "https://gone.example").block());
    }

    @Test
    @DisplayName("HTTP probing uses the family-bound clients")
    void httpProbe() {
        ScannerProperties props = TestSupport.withProbe(new ScannerProperties.Probe(
            null, null, null, null, null, null, null, null, null, null, null, true, null));
        when(http.fetchIpv4("https://mirror.example.net/")).thenReturn(Mono.just(new FetchResponse(200, "", 5)));
        when(http.fetchIpv6("https://mirror.example.net/"))
            .thenReturn(Mono.error(new TransientNetworkException("Network unreachable", null)));
        ConnectivityClassifier classifier = new ConnectivityClassifier(http, props, host -> {
            throw new AssertionError("DNS not expected");
        });

        assertEquals(Connectivity.IPV4, classifier.classify("mirror.example.net", "https://mirror.example.net").block());
    }
}
