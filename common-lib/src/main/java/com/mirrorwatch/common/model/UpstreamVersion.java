package com.mirrorwatch.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * Latest known head commit of the tracked upstream branch.
 *
 * <p>{@code commit} is {@code null} until the first successful refresh.
 */
public record UpstreamVersion(
    @JsonProperty("commit")     String  commit,
    @JsonProperty("branch")     String  branch,
    @JsonProperty("resolvedAt") Instant resolvedAt
) {

    /** Minimum length of an abbreviated SHA accepted for head matching. */
    public static final int MIN_SHA_LENGTH = 7;

    public static UpstreamVersion unknown(String branch) {
        return new UpstreamVersion(null, branch, null);
    }

    @JsonIgnore
    public boolean isKnown() {
        return commit != null;
    }

    /**
     * True when {@code sha} names the head commit, full or abbreviated.
     */
    public boolean isHead(String sha) {
        if (commit == null || sha == null || sha.length() < MIN_SHA_LENGTH) {
            return false;
        }
        return commit.toLowerCase(Locale.ROOT).startsWith(sha.toLowerCase(Locale.ROOT));
    }
}
