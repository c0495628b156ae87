package com.mirrorwatch.scanner.config;

import com.mirrorwatch.common.exception.ConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Scanner configuration bound from the {@code scanner.*} namespace of {@code application.yml}.
 *
 * <p>Every nested group falls back to its defaults when absent, so a minimal deployment only
 * sets {@code scanner.site-url} and the datasource. Invalid combinations fail at startup.
 *
 * <pre>{@code
 * scanner:
 *   site-url: https://status.example.net
 *   probe:
 *     interval: 15m
 *     concurrency: 16
 *   registry:
 *     additional-hosts: [https://mirror.example.net]
 *   retention:
 *     error-cap: 100
 * }</pre>
 *
 * @param healthChecksEnabled kill switch; when false only the cleanup loop runs
 * @param siteUrl             public URL of this service, advertised in the user agent
 * @param adminDomains        domains with admin rights on the status site; bound only
 */
@Validated
@ConfigurationProperties(prefix = "scanner")
public record ScannerProperties(
    Boolean       healthChecksEnabled,
    String        siteUrl,
    List<String>  adminDomains,
    @Valid Http      http,
    @Valid Probe     probe,
    @Valid Registry  registry,
    @Valid Upstream  upstream,
    @Valid Retention retention,
    @Valid Stats     stats,
    @Valid Scoring   scoring
) {

    public ScannerProperties {
        healthChecksEnabled = healthChecksEnabled == null ? Boolean.TRUE : healthChecksEnabled;
        siteUrl      = siteUrl == null ? "" : siteUrl;
        adminDomains = adminDomains == null ? List.of() : List.copyOf(adminDomains);
        http      = http      == null ? new Http(null, null, null)                  : http;
        probe     = probe     == null ? Probe.defaults()                           : probe;
        registry  = registry  == null ? new Registry(null, null, null, null, null, null) : registry;
        upstream  = upstream  == null ? new Upstream(null, null, null, null, null)   : upstream;
        retention = retention == null ? new Retention(null, null, null, null)        : retention;
        stats     = stats     == null ? new Stats(null, null, null)                  : stats;
        scoring   = scoring   == null ? new Scoring(null, null)                      : scoring;

        requirePositive("scanner.probe.interval", probe.interval());
        requirePositive("scanner.probe.budget", probe.budget());
        requirePositive("scanner.probe.tick-deadline", probe.tickDeadline());
        requirePositive("scanner.registry.interval", registry.interval());
        requirePositive("scanner.upstream.refresh-interval", upstream.refreshInterval());
        requirePositive("scanner.retention.cleanup-interval", retention.cleanupInterval());
        requirePositive("scanner.stats.interval", stats.interval());
    }

    public boolean isHealthChecksEnabled() {
        return healthChecksEnabled;
    }

    /** User agent sent on every outbound request; defaults to one naming this site. */
    public String userAgent() {
        return http.userAgent() != null
            ? http.userAgent()
            : "mirror-watch (+" + siteUrl + "/about)";
    }

    // ── nested groups ────────────────────────────────────────────────────────

    public record Http(
        Duration connectTimeout,
        Duration responseTimeout,
        String   userAgent
    ) {
        public Http {
            connectTimeout  = connectTimeout  == null ? Duration.ofSeconds(5)  : connectTimeout;
            responseTimeout = responseTimeout == null ? Duration.ofSeconds(10) : responseTimeout;
        }
    }

    /**
     * @param interval          cadence of probe ticks
     * @param concurrency       in-flight probes per tick
     * @param budget            upper bound for each check of one probe
     * @param tickDeadline      dispatch stops after this much of a tick has elapsed
     * @param profileName       expected profile card text; blank disables the check
     * @param profilePostsMin   minimum number of timeline items
     * @param rssContent        case-insensitive regex the RSS body must match
     * @param connectivityProbe also try IPv4 and IPv6 bound requests, not only DNS
     * @param skipBadHosts      leave bad hosts out of probe ticks
     */
    public record Probe(
        Duration interval,
        @Positive Integer concurrency,
        Duration budget,
        Duration tickDeadline,
        String   profilePath,
        String   rssPath,
        String   aboutPath,
        String   connectivityPath,
        String   profileName,
        @PositiveOrZero Integer profilePostsMin,
        String   rssContent,
        Boolean  connectivityProbe,
        Boolean  skipBadHosts
    ) {
        static Probe defaults() {
            return new Probe(null, null, null, null, null, null, null, null, null, null, null, null, null);
        }

        public Probe {
            interval         = interval         == null ? Duration.ofMinutes(15) : interval;
            concurrency      = concurrency      == null ? 16                     : concurrency;
            budget           = budget           == null ? Duration.ofSeconds(30) : budget;
            tickDeadline     = tickDeadline     == null ? interval.multipliedBy(9).dividedBy(10) : tickDeadline;
            profilePath      = profilePath      == null ? "/jack"                : profilePath;
            rssPath          = rssPath          == null ? "/jack/rss"            : rssPath;
            aboutPath        = aboutPath        == null ? "/about"               : aboutPath;
            connectivityPath = connectivityPath == null ? "/"                    : connectivityPath;
            profileName      = profileName      == null ? "@jack"                : profileName;
            profilePostsMin  = profilePostsMin  == null ? 5                      : profilePostsMin;
            rssContent       = rssContent       == null ? "<rss xmlns\\:atom"    : rssContent;
            connectivityProbe = connectivityProbe != null && connectivityProbe;
            skipBadHosts      = skipBadHosts     != null && skipBadHosts;
            if (tickDeadline.compareTo(interval) > 0) {
                throw new ConfigurationException("scanner.probe.tick-deadline must not exceed scanner.probe.interval");
            }
        }
    }

    /**
     * @param retireAfterMisses disable a host after this many passes absent from the listing;
     *                          0 never disables, the host is only reported as stale
     */
    public record Registry(
        String       listUrl,
        Duration     interval,
        List<String> additionalHosts,
        String       additionalHostCountry,
        List<String> badHosts,
        @PositiveOrZero Integer retireAfterMisses
    ) {
        public Registry {
            listUrl               = listUrl  == null ? "https://github.com/zedeus/nitter/wiki/Instances" : listUrl;
            interval              = interval == null ? Duration.ofMinutes(15) : interval;
            additionalHosts       = additionalHosts == null ? List.of() : List.copyOf(additionalHosts);
            additionalHostCountry = additionalHostCountry == null ? "" : additionalHostCountry;
            badHosts              = badHosts == null ? List.of() : List.copyOf(badHosts);
            retireAfterMisses     = retireAfterMisses == null ? 0 : retireAfterMisses;
        }
    }

    /**
     * @param repositoryUrl web URL of the upstream repository; version links must point below it
     * @param apiBaseUrl    REST API root of the repository host
     * @param apiToken      optional token raising the API rate limit
     */
    public record Upstream(
        String   repositoryUrl,
        String   branch,
        String   apiBaseUrl,
        String   apiToken,
        Duration refreshInterval
    ) {
        public Upstream {
            repositoryUrl   = repositoryUrl == null ? "https://github.com/zedeus/nitter" : stripSlash(repositoryUrl);
            branch          = branch        == null ? "master"                 : branch;
            apiBaseUrl      = apiBaseUrl    == null ? "https://api.github.com" : stripSlash(apiBaseUrl);
            refreshInterval = refreshInterval == null ? Duration.ofMinutes(15) : refreshInterval;
        }

        /** {@code owner/repo} path of the repository URL. */
        public String slug() {
            String path = repositoryUrl.replaceFirst("^[a-zA-Z]+://[^/]+/", "");
            return path.endsWith(".git") ? path.substring(0, path.length() - 4) : path;
        }
    }

    /**
     * @param errorCap      error records kept per instance
     * @param healthHorizon delete checks older than this; {@code null} keeps everything
     * @param autoMute      hosts already down or known bad produce no error records
     */
    public record Retention(
        Duration cleanupInterval,
        @PositiveOrZero Integer errorCap,
        Duration healthHorizon,
        Boolean  autoMute
    ) {
        public static final Duration MIN_HEALTH_HORIZON = Duration.ofDays(120);

        public Retention {
            cleanupInterval = cleanupInterval == null ? Duration.ofHours(24) : cleanupInterval;
            errorCap        = errorCap == null ? 100 : errorCap;
            autoMute        = autoMute == null || autoMute;
            if (healthHorizon != null && healthHorizon.compareTo(MIN_HEALTH_HORIZON) < 0) {
                throw new ConfigurationException("scanner.retention.health-horizon must be at least "
                    + MIN_HEALTH_HORIZON.toDays() + " days, got " + healthHorizon);
            }
        }
    }

    public record Stats(
        Duration interval,
        String   path,
        @Positive Integer concurrency
    ) {
        public Stats {
            interval    = interval    == null ? Duration.ofMinutes(15) : interval;
            path        = path        == null ? "/.health"             : path;
            concurrency = concurrency == null ? 16                     : concurrency;
        }
    }

    /**
     * @param pingRange     window for response time statistics
     * @param recentChecks  checks shown in the recent history strip
     */
    public record Scoring(
        Duration pingRange,
        @Positive Integer recentChecks
    ) {
        public Scoring {
            pingRange    = pingRange    == null ? Duration.ofHours(3) : pingRange;
            recentChecks = recentChecks == null ? 22                  : recentChecks;
        }
    }

    private static String stripSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
    }
}
