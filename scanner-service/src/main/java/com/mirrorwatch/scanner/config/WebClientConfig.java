package com.mirrorwatch.scanner.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.resolver.ResolvedAddressTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Outbound HTTP clients.
 *
 * <ul>
 *   <li>{@code instanceWebClient} – instance probes, stats and the registry page. Sends
 *       browser-like headers; non-2xx responses are passed through for classification.</li>
 *   <li>{@code ipv4WebClient} / {@code ipv6WebClient} – same settings, bound to one address
 *       family, used by the connectivity probe.</li>
 *   <li>{@code upstreamWebClient} – REST API of the upstream repository host.</li>
 * </ul>
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    static final String ACCEPT =
        "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8";
    static final String ACCEPT_LANGUAGE = "de,en-US;q=0.7,en;q=0.3";

    /** Registry pages and instance bodies can exceed the 256 KiB codec default. */
    static final int MAX_BODY_BYTES = 4 * 1024 * 1024;

    @Bean
    public WebClient instanceWebClient(WebClient.Builder builder, ScannerProperties properties) {
        return browserLike(builder.clone(), properties, baseHttpClient(properties));
    }

    @Bean
    public WebClient ipv4WebClient(WebClient.Builder builder, ScannerProperties properties) {
        HttpClient httpClient = baseHttpClient(properties)
            .bindAddress(() -> new InetSocketAddress("0.0.0.0", 0))
            .resolver(spec -> spec.resolvedAddressTypes(ResolvedAddressTypes.IPV4_ONLY));
        return browserLike(builder.clone(), properties, httpClient);
    }

    @Bean
    public WebClient ipv6WebClient(WebClient.Builder builder, ScannerProperties properties) {
        HttpClient httpClient = baseHttpClient(properties)
            .bindAddress(() -> new InetSocketAddress("::", 0))
            .resolver(spec -> spec.resolvedAddressTypes(ResolvedAddressTypes.IPV6_ONLY));
        return browserLike(builder.clone(), properties, httpClient);
    }

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder builder, ScannerProperties properties) {
        ScannerProperties.Upstream upstream = properties.upstream();
        WebClient.Builder configured = builder.clone()
            .baseUrl(upstream.apiBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(baseHttpClient(properties)))
            .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
            .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
            .filter(loggingFilter());
        if (upstream.apiToken() != null && !upstream.apiToken().isBlank()) {
            configured.defaultHeaders(h -> h.setBearerAuth(upstream.apiToken()));
        }
        return configured.build();
    }

    // ── shared settings ───────────────────────────────────────────────────────

    private HttpClient baseHttpClient(ScannerProperties properties) {
        ScannerProperties.Http http = properties.http();
        long readTimeoutMs = http.responseTimeout().toMillis();
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.connectTimeout().toMillis())
            .responseTimeout(http.responseTimeout())
            .compress(true)
            .followRedirect(true)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
            );
    }

    private WebClient browserLike(WebClient.Builder builder, ScannerProperties properties, HttpClient httpClient) {
        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                .build())
            .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
            .defaultHeader(HttpHeaders.ACCEPT, ACCEPT)
            .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, ACCEPT_LANGUAGE)
            .defaultHeader("Sec-Fetch-Dest", "document")
            .defaultHeader("Sec-Fetch-Mode", "navigate")
            .defaultHeader("Sec-Fetch-Site", "none")
            .defaultHeader("Sec-Fetch-User", "?1")
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
