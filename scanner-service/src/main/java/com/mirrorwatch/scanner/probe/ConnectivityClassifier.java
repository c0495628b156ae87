package com.mirrorwatch.scanner.probe;

import com.mirrorwatch.common.model.Connectivity;
import com.mirrorwatch.scanner.client.InstanceHttpClient;
import com.mirrorwatch.scanner.config.ScannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * Determines over which IP families an instance is reachable.
 *
 * <p>By default only DNS is consulted (A and AAAA records). With
 * {@code scanner.probe.connectivity-probe=true} the connectivity path is requested once
 * through an IPv4-bound and once through an IPv6-bound client instead.
 */
@Component
public class ConnectivityClassifier {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityClassifier.class);

    @FunctionalInterface
    interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final InstanceHttpClient httpClient;
    private final HostResolver       resolver;
    private final boolean            httpProbe;
    private final String             path;

    @Autowired
    public ConnectivityClassifier(InstanceHttpClient httpClient, ScannerProperties properties) {
        this(httpClient, properties, InetAddress::getAllByName);
    }

    ConnectivityClassifier(InstanceHttpClient httpClient, ScannerProperties properties, HostResolver resolver) {
        this.httpClient = httpClient;
        this.resolver   = resolver;
        this.httpProbe  = properties.probe().connectivityProbe();
        this.path       = properties.probe().connectivityPath();
    }

    /** Never errors; anything that cannot be determined is {@link Connectivity#UNKNOWN}. */
    public Mono<Connectivity> classify(String domain, String baseUrl) {
        Mono<Connectivity> result = httpProbe ? viaHttp(baseUrl + path) : viaDns(domain);
        return result
            .defaultIfEmpty(Connectivity.UNKNOWN)
            .onErrorResume(e -> {
                log.debug("Connectivity check failed. domain={} reason={}", domain, e.getMessage());
                return Mono.just(Connectivity.UNKNOWN);
            });
    }

    private Mono<Connectivity> viaDns(String domain) {
        return Mono.fromCallable(() -> resolver.resolve(domain))
            .subscribeOn(Schedulers.boundedElastic())
            .map(addresses -> Connectivity.of(
                Arrays.stream(addresses).anyMatch(a -> a instanceof Inet4Address),
                Arrays.stream(addresses).anyMatch(a -> a instanceof Inet6Address)));
    }

    private Mono<Connectivity> viaHttp(String url) {
        Mono<Boolean> ipv4 = httpClient.fetchIpv4(url).map(r -> true).onErrorReturn(false);
        Mono<Boolean> ipv6 = httpClient.fetchIpv6(url).map(r -> true).onErrorReturn(false);
        return Mono.zip(ipv4, ipv6).map(t -> Connectivity.of(t.getT1(), t.getT2()));
    }
}
