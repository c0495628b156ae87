package com.mirrorwatch.scanner.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.mirrorwatch.common.exception.UpstreamLookupException;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.upstream.ComparisonStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * REST lookups against the upstream repository host: branch heads and commit comparisons.
 * No clone is made; each question costs one request.
 */
@Component
public class UpstreamRepositoryClient {

    private static final Logger log = LoggerFactory.getLogger(UpstreamRepositoryClient.class);

    private final WebClient upstreamWebClient;
    private final String    slug;

    public UpstreamRepositoryClient(@Qualifier("upstreamWebClient") WebClient upstreamWebClient,
                                    ScannerProperties properties) {
        this.upstreamWebClient = upstreamWebClient;
        this.slug              = properties.upstream().slug();
    }

    /**
     * @return full SHA of the branch head
     * @throws UpstreamLookupException (as error signal) on any failure
     */
    public Mono<String> fetchBranchHead(String branch) {
        return upstreamWebClient.get()
            .uri(b -> b.path("/repos/" + slug + "/branches/" + branch).build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .flatMap(json -> {
                String sha = json.path("commit").path("sha").asText(null);
                if (sha == null || sha.isBlank()) {
                    return Mono.error(new UpstreamLookupException("Branch response without commit sha. branch=" + branch));
                }
                return Mono.just(sha);
            })
            .onErrorMap(e -> !(e instanceof UpstreamLookupException),
                        e -> new UpstreamLookupException("Branch head lookup failed. branch=" + branch, e));
    }

    /**
     * Compares {@code sha} against {@code branch}. Unknown commits (404, 422) are answered
     * with {@link ComparisonStatus#NOT_FOUND}; other failures are errors.
     */
    public Mono<ComparisonStatus> compare(String sha, String branch) {
        return upstreamWebClient.get()
            .uri(b -> b.path("/repos/" + slug + "/compare/" + sha + "..." + branch).build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> ComparisonStatus.fromApi(json.path("status").asText(null)))
            .onErrorResume(WebClientResponseException.class, e -> {
                int status = e.getStatusCode().value();
                if (status == 404 || status == 422) {
                    log.debug("Commit unknown upstream. sha={} status={}", sha, status);
                    return Mono.just(ComparisonStatus.NOT_FOUND);
                }
                return Mono.error(new UpstreamLookupException(
                    "Commit comparison failed. sha=" + sha + " status=" + status, e));
            })
            .onErrorMap(e -> !(e instanceof UpstreamLookupException),
                        e -> new UpstreamLookupException("Commit comparison failed. sha=" + sha, e));
    }
}
