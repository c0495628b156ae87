package com.mirrorwatch.scanner.model;

import java.util.Arrays;
import java.util.Optional;

public enum OverrideKey {
    PROFILE_PATH("profile_path"),
    RSS_PATH("rss_path"),
    ABOUT_PATH("about_path"),
    STATS_PATH("stats_path"),
    STATS_QUERY("stats_query"),
    STATS_BEARER("stats_bearer");

    private final String key;

    OverrideKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<OverrideKey> fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
    }
}
