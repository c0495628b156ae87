package com.mirrorwatch.common.parser;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Host name normalization shared by the registry listing, the static host lists
 * and the instance table.
 *
 * <p>Accepts bare host names as well as URLs; strips scheme, user info, port,
 * path, query and trailing dots or slashes. Returns {@code null} for input
 * that carries no usable host.
 */
public final class HostNames {

    private HostNames() {}

    public static String normalize(String raw) {
        URI uri = toUri(raw);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host.isEmpty() ? null : host;
    }

    /**
     * Base URL ({@code scheme://host[:port]}) used for probing. Missing schemes default to https.
     */
    public static String toBaseUrl(String raw) {
        URI uri = toUri(raw);
        String host = normalize(raw);
        if (uri == null || host == null) {
            return null;
        }
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        return uri.getPort() > 0
            ? scheme + "://" + host + ":" + uri.getPort()
            : scheme + "://" + host;
    }

    private static URI toUri(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) return null;
        if (!trimmed.contains("://")) {
            trimmed = "https://" + trimmed;
        }
        try {
            return new URI(trimmed);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
