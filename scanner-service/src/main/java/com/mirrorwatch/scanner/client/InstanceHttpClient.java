package com.mirrorwatch.scanner.client;

import com.mirrorwatch.common.exception.ErrorCategory;
import com.mirrorwatch.common.exception.HttpStatusException;
import com.mirrorwatch.common.exception.ScannerException;
import com.mirrorwatch.common.exception.TransientNetworkException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.TimeoutException;

/**
 * GET requests against monitored instances and the registry page.
 *
 * <p>Emits a {@link FetchResponse} for 2xx responses only. Everything else is an error:
 * <ul>
 *   <li>unparseable URL → {@code INVALID_URL}</li>
 *   <li>connect / TLS / reset → {@link TransientNetworkException}; read timeouts → {@code TIMEOUT}</li>
 *   <li>non-2xx → {@link HttpStatusException}, see {@link #classify(int, String)}</li>
 * </ul>
 */
@Component
public class InstanceHttpClient {

    private static final Logger log = LoggerFactory.getLogger(InstanceHttpClient.class);

    static final String CAPTCHA_TEXT      = "Enable JavaScript and cookies to continue";
    static final String BLOCKED_TEXT      = "You have been blocked";
    static final String RATE_LIMITED_TEXT = "Instance has been rate limited";

    private final WebClient instanceWebClient;
    private final WebClient ipv4WebClient;
    private final WebClient ipv6WebClient;

    public InstanceHttpClient(@Qualifier("instanceWebClient") WebClient instanceWebClient,
                              @Qualifier("ipv4WebClient") WebClient ipv4WebClient,
                              @Qualifier("ipv6WebClient") WebClient ipv6WebClient) {
        this.instanceWebClient = instanceWebClient;
        this.ipv4WebClient     = ipv4WebClient;
        this.ipv6WebClient     = ipv6WebClient;
    }

    public Mono<FetchResponse> fetch(String url) {
        return fetch(instanceWebClient, url, null);
    }

    public Mono<FetchResponse> fetch(String url, String bearerToken) {
        return fetch(instanceWebClient, url, bearerToken);
    }

    /** Same request through the IPv4-only client. */
    public Mono<FetchResponse> fetchIpv4(String url) {
        return fetch(ipv4WebClient, url, null);
    }

    /** Same request through the IPv6-only client. */
    public Mono<FetchResponse> fetchIpv6(String url) {
        return fetch(ipv6WebClient, url, null);
    }

    private Mono<FetchResponse> fetch(WebClient client, String url, String bearerToken) {
        URI uri = parseUri(url);
        if (uri == null) {
            return Mono.error(new ScannerException(ErrorCategory.INVALID_URL, "Can't parse instance URL: " + url));
        }

        return Mono.defer(() -> {
            long started = System.nanoTime();
            return client.get()
                .uri(uri)
                .headers(h -> {
                    if (bearerToken != null && !bearerToken.isBlank()) {
                        h.setBearerAuth(bearerToken);
                    }
                })
                .exchangeToMono(response -> response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> new FetchResponse(response.statusCode().value(), body,
                                                   (System.nanoTime() - started) / 1_000_000)))
                .onErrorMap(e -> !(e instanceof ScannerException), InstanceHttpClient::toTransportError)
                .flatMap(response -> {
                    if (response.status() >= 200 && response.status() < 300) {
                        return Mono.just(response);
                    }
                    log.debug("Non-success response. url={} status={}", url, response.status());
                    return Mono.error(classify(response.status(), response.body(), response.elapsedMs()));
                });
        });
    }

    // ── status mapping ────────────────────────────────────────────────────────

    /**
     * Maps a non-2xx response to an exception. Captcha walls, firewall blocks and exhausted
     * rate limits get their own categories. For statuses whose bodies are boilerplate
     * (404, 502–504, Cloudflare 520–527) the body is dropped.
     */
    static HttpStatusException classify(int status, String body) {
        return classify(status, body, null);
    }

    static HttpStatusException classify(int status, String body, Long elapsedMs) {
        String text   = body == null ? "" : body;
        String reason = reasonPhrase(status);

        if (status == 403 && text.contains(CAPTCHA_TEXT)) {
            return new HttpStatusException(ErrorCategory.CAPTCHA, status, "Captcha detected", null, elapsedMs);
        }
        if (status == 403 && text.contains(BLOCKED_TEXT)) {
            return new HttpStatusException(ErrorCategory.BLOCKED, status,
                "Known bad response on status " + reason, text, elapsedMs);
        }
        if (status == 429 && text.contains(RATE_LIMITED_TEXT)) {
            return new HttpStatusException(ErrorCategory.RATE_LIMITED, status,
                "Known bad response on status " + reason, text, elapsedMs);
        }
        if (status == 404 || (status >= 502 && status <= 504) || (status >= 520 && status <= 527)) {
            return new HttpStatusException(ErrorCategory.HTTP_STATUS, status,
                "Known bad response on status " + reason, null, elapsedMs);
        }
        return new HttpStatusException(ErrorCategory.HTTP_STATUS, status,
            "Url fetching failed, host responded with status " + status + " '" + reason + "'", text, elapsedMs);
    }

    static ScannerException toTransportError(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof ReadTimeoutException || cause instanceof TimeoutException) {
                return new TransientNetworkException(ErrorCategory.TIMEOUT, "Request timed out");
            }
            cause = cause.getCause();
        }
        return new TransientNetworkException("Http fetch error: " + e.getMessage(), e);
    }

    private static URI parseUri(String url) {
        if (url == null) return null;
        try {
            URI uri = new URI(url);
            return uri.getHost() == null ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String reasonPhrase(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved == null ? String.valueOf(status) : resolved.getReasonPhrase();
    }
}
