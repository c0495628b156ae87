package com.mirrorwatch.scanner.probe;

import com.mirrorwatch.common.exception.ConfigurationException;
import com.mirrorwatch.common.exception.ContentMismatchException;
import com.mirrorwatch.common.exception.ErrorCategory;
import com.mirrorwatch.common.exception.HttpStatusException;
import com.mirrorwatch.common.exception.ScannerException;
import com.mirrorwatch.common.model.AboutVersion;
import com.mirrorwatch.common.model.CommitState;
import com.mirrorwatch.common.model.Connectivity;
import com.mirrorwatch.common.model.ProbeError;
import com.mirrorwatch.common.model.ProbeResult;
import com.mirrorwatch.common.model.ProfileContent;
import com.mirrorwatch.common.parser.AboutParser;
import com.mirrorwatch.common.parser.ProfileParser;
import com.mirrorwatch.scanner.client.FetchResponse;
import com.mirrorwatch.scanner.client.InstanceHttpClient;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.model.Instance;
import com.mirrorwatch.scanner.model.InstanceOverrides;
import com.mirrorwatch.scanner.model.OverrideKey;
import com.mirrorwatch.scanner.upstream.UpstreamVersionOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Probes one instance: profile, RSS, about page and connectivity, concurrently.
 *
 * <p>Only the profile check decides health. The other checks fail independently and
 * degrade to {@code rss=false}, no version and {@link Connectivity#UNKNOWN}. Each check is
 * bounded by {@code scanner.probe.budget}. A late secondary check degrades like a failed one;
 * only a late profile check yields an unhealthy {@link ErrorCategory#TIMEOUT} result.
 * {@link #probe} never signals an error.
 */
@Service
public class HealthProber {

    private static final Logger log = LoggerFactory.getLogger(HealthProber.class);

    private final InstanceHttpClient     httpClient;
    private final UpstreamVersionOracle  oracle;
    private final ConnectivityClassifier connectivityClassifier;
    private final ScannerProperties.Probe config;
    private final ProfileParser          profileParser = new ProfileParser();
    private final AboutParser            aboutParser   = new AboutParser();
    private final Pattern                rssPattern;

    public HealthProber(InstanceHttpClient httpClient,
                        UpstreamVersionOracle oracle,
                        ConnectivityClassifier connectivityClassifier,
                        ScannerProperties properties) {
        this.httpClient             = httpClient;
        this.oracle                 = oracle;
        this.connectivityClassifier = connectivityClassifier;
        this.config                 = properties.probe();
        try {
            this.rssPattern = Pattern.compile(config.rssContent(), Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid scanner.probe.rss-content regex: " + e.getMessage());
        }
    }

    private record ProfileCheck(boolean healthy, Integer responseTimeMs, Integer httpStatus, ProbeError error) {}

    private record VersionCheck(String versionName, String versionUrl, CommitState state) {
        static final VersionCheck NONE = new VersionCheck(null, null, CommitState.UNKNOWN_COMMIT);
    }

    public Mono<ProbeResult> probe(Instance instance, InstanceOverrides overrides, Instant checkedAt) {
        long     id     = instance.getId();
        String   base   = instance.getUrl();
        String   domain = instance.getDomain();
        Duration budget = config.budget();

        Mono<ProfileCheck> profile = checkProfile(
                base + overrides.getOrDefault(OverrideKey.PROFILE_PATH, config.profilePath()), checkedAt)
            .timeout(budget, Mono.fromSupplier(() -> new ProfileCheck(false, null, null, ProbeError.of(
                ErrorCategory.TIMEOUT, "Profile check exceeded budget of " + budget.toMillis() + "ms", checkedAt))));
        Mono<Boolean> rss = checkRss(
                domain, base + overrides.getOrDefault(OverrideKey.RSS_PATH, config.rssPath()))
            .timeout(budget, late(domain, "RSS", false));
        Mono<VersionCheck> version = checkVersion(
                domain, base + overrides.getOrDefault(OverrideKey.ABOUT_PATH, config.aboutPath()))
            .timeout(budget, late(domain, "Version", VersionCheck.NONE));
        Mono<Connectivity> connectivity = connectivityClassifier.classify(domain, base)
            .timeout(budget, late(domain, "Connectivity", Connectivity.UNKNOWN));

        return Mono.zip(profile, rss, version, connectivity)
            .map(t -> {
                ProfileCheck p = t.getT1();
                VersionCheck v = t.getT3();
                return new ProbeResult(id, checkedAt, p.healthy(), p.responseTimeMs(), p.httpStatus(),
                    v.versionName(), v.versionUrl(), v.state().isUpstream(), v.state().isLatest(),
                    t.getT2(), t.getT4(), p.error());
            })
            .onErrorResume(e -> {
                log.error("Probe crashed. domain={}", domain, e);
                return Mono.just(ProbeResult.failed(id, checkedAt,
                    ProbeError.of(ErrorCategory.INTERNAL, "Probe crashed: " + e.getMessage(), checkedAt)));
            })
            .doOnNext(r -> log.debug("Probe finished. domain={} healthy={} responseTimeMs={} rss={} version={} connectivity={}",
                domain, r.healthy(), r.responseTimeMs(), r.rss(), r.versionName(), r.connectivity()));
    }

    private static <T> Mono<T> late(String domain, String check, T fallback) {
        return Mono.fromSupplier(() -> {
            log.debug("{} check exceeded budget. domain={}", check, domain);
            return fallback;
        });
    }

    // ── profile ───────────────────────────────────────────────────────────────

    private Mono<ProfileCheck> checkProfile(String url, Instant checkedAt) {
        return httpClient.fetch(url)
            .map(response -> evaluateProfile(response, checkedAt))
            .onErrorResume(ScannerException.class, e -> {
                if (e instanceof HttpStatusException http) {
                    Integer elapsed = http.getElapsedMs() == null ? null : http.getElapsedMs().intValue();
                    return Mono.just(new ProfileCheck(false, elapsed, http.getStatus(), ProbeError.of(e, checkedAt)));
                }
                return Mono.just(new ProfileCheck(false, null, null, ProbeError.of(e, checkedAt)));
            });
    }

    private ProfileCheck evaluateProfile(FetchResponse response, Instant checkedAt) {
        int elapsed = (int) response.elapsedMs();
        try {
            ProfileContent content = profileParser.parse(response.body());
            String expected = config.profileName();
            if (expected != null && !expected.isBlank() && !expected.equalsIgnoreCase(content.name())) {
                throw new ContentMismatchException(
                    "Profile name mismatch, expected '" + expected + "' got '" + content.name() + "'");
            }
            if (content.postCount() < config.profilePostsMin()) {
                throw new ContentMismatchException("Found only " + content.postCount()
                    + " timeline posts, expected at least " + config.profilePostsMin());
            }
            return new ProfileCheck(true, elapsed, response.status(), null);
        } catch (ScannerException e) {
            return new ProfileCheck(false, elapsed, response.status(), ProbeError.of(e, checkedAt));
        }
    }

    // ── rss ───────────────────────────────────────────────────────────────────

    private Mono<Boolean> checkRss(String domain, String url) {
        return httpClient.fetch(url)
            .map(response -> rssPattern.matcher(response.body()).find())
            .onErrorResume(e -> {
                log.debug("RSS check failed. domain={} reason={}", domain, e.getMessage());
                return Mono.just(false);
            });
    }

    // ── about / version ───────────────────────────────────────────────────────

    private Mono<VersionCheck> checkVersion(String domain, String url) {
        return httpClient.fetch(url)
            .map(response -> aboutParser.parse(response.body()))
            .flatMap((AboutVersion about) -> oracle.classify(about.url())
                .map(state -> new VersionCheck(about.versionName(), about.url(), state)))
            .defaultIfEmpty(VersionCheck.NONE)
            .onErrorResume(e -> {
                log.debug("Version check failed. domain={} reason={}", domain, e.getMessage());
                return Mono.just(VersionCheck.NONE);
            });
    }
}
