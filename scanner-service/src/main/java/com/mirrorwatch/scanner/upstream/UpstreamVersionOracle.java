package com.mirrorwatch.scanner.upstream;

import com.mirrorwatch.common.model.CommitState;
import com.mirrorwatch.common.model.UpstreamVersion;
import com.mirrorwatch.scanner.client.UpstreamRepositoryClient;
import com.mirrorwatch.scanner.config.ScannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tracks the head of the upstream branch and classifies the commits instances report.
 *
 * <p>Classification of a version URL:
 * <pre>
 *   not {repository-url}/commit/{sha}  → CUSTOM_BRANCH
 *   sha is a prefix of the head        → CURRENT
 *   compare {sha}...{branch}:
 *     identical                        → CURRENT
 *     ahead (branch ahead of sha)      → OUTDATED
 *     behind / diverged                → CUSTOM_BRANCH
 *     unknown commit                   → UNKNOWN_COMMIT
 *   lookup failure                     → UNKNOWN_COMMIT, not cached
 * </pre>
 *
 * <p>Concurrent classifications of the same uncached SHA share one compare request.
 */
@Service
public class UpstreamVersionOracle {

    private static final Logger log = LoggerFactory.getLogger(UpstreamVersionOracle.class);

    private static final Pattern SHA = Pattern.compile("^([0-9a-fA-F]{7,40})(?:[/?#].*)?$");

    private final UpstreamRepositoryClient client;
    private final UpstreamVersionHolder    holder;
    private final CommitLineageCache       cache = new CommitLineageCache();
    private final ConcurrentMap<String, Mono<CommitState>> inFlight = new ConcurrentHashMap<>();
    private final Clock                    clock;
    private final String                   branch;
    private final String                   commitPrefix;

    public UpstreamVersionOracle(UpstreamRepositoryClient client,
                                 UpstreamVersionHolder holder,
                                 ScannerProperties properties,
                                 Clock clock) {
        this.client       = client;
        this.holder       = holder;
        this.clock        = clock;
        this.branch       = properties.upstream().branch();
        this.commitPrefix = withoutScheme(properties.upstream().repositoryUrl()) + "/commit/";
    }

    /**
     * Resolves the branch head. On failure the previous value is kept and emitted.
     */
    public Mono<UpstreamVersion> refresh() {
        return client.fetchBranchHead(branch)
            .map(sha -> new UpstreamVersion(sha, branch, clock.instant()))
            .doOnNext(version -> {
                UpstreamVersion previous = holder.set(version);
                boolean changed = !Objects.equals(previous.commit(), version.commit());
                int cached = cache.advanceEpoch(changed);
                log.info("UPSTREAM_REFRESHED branch={} commit={} changed={} cachedCommits={}",
                         branch, version.commit(), changed, cached);
            })
            .onErrorResume(e -> {
                UpstreamVersion previous = holder.get();
                log.warn("Upstream refresh failed, keeping previous head. branch={} commit={} reason={}",
                         branch, previous.commit(), e.getMessage());
                return Mono.just(previous);
            });
    }

    public UpstreamVersion current() {
        return holder.get();
    }

    public Mono<CommitState> classify(String versionUrl) {
        String sha = extractCommit(versionUrl);
        if (sha == null) {
            return Mono.just(CommitState.CUSTOM_BRANCH);
        }
        if (holder.get().isHead(sha)) {
            return Mono.just(CommitState.CURRENT);
        }
        return cache.get(sha)
            .map(Mono::just)
            .orElseGet(() -> lookup(sha));
    }

    private Mono<CommitState> lookup(String sha) {
        return inFlight.computeIfAbsent(sha, key -> Mono.defer(() -> client.compare(key, branch))
            .map(UpstreamVersionOracle::toState)
            .doOnNext(state -> {
                cache.put(key, state);
                log.debug("Commit classified. sha={} state={}", key, state);
            })
            .onErrorResume(e -> {
                log.warn("Commit lookup failed. sha={} reason={}", key, e.getMessage());
                return Mono.just(CommitState.UNKNOWN_COMMIT);
            })
            .doFinally(signal -> inFlight.remove(key))
            .cache());
    }

    static CommitState toState(ComparisonStatus status) {
        return switch (status) {
            case IDENTICAL          -> CommitState.CURRENT;
            case AHEAD              -> CommitState.OUTDATED;
            case BEHIND, DIVERGED   -> CommitState.CUSTOM_BRANCH;
            case NOT_FOUND          -> CommitState.UNKNOWN_COMMIT;
        };
    }

    /** SHA from {@code <repository-url>/commit/<sha>}, or {@code null} for any other URL. */
    String extractCommit(String versionUrl) {
        if (versionUrl == null) return null;
        String url = withoutScheme(versionUrl.trim());
        if (!url.toLowerCase(Locale.ROOT).startsWith(commitPrefix.toLowerCase(Locale.ROOT))) {
            return null;
        }
        Matcher m = SHA.matcher(url.substring(commitPrefix.length()));
        return m.matches() ? m.group(1) : null;
    }

    private static String withoutScheme(String url) {
        return url.replaceFirst("^[a-zA-Z]+://", "");
    }
}
