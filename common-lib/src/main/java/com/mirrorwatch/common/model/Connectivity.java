package com.mirrorwatch.common.model;

/**
 * IP reachability of an instance. {@link #ALL} means dual stack.
 */
public enum Connectivity {
    IPV4,
    IPV6,
    ALL,
    UNKNOWN;

    public static Connectivity of(boolean ipv4, boolean ipv6) {
        if (ipv4 && ipv6) return ALL;
        if (ipv4)         return IPV4;
        if (ipv6)         return IPV6;
        return UNKNOWN;
    }
}
