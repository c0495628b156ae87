package com.mirrorwatch.common.model;

/**
 * One host as it appears in the merged registry listing.
 *
 * @param domain     normalized host name, the identity key
 * @param url        base URL used for probing
 * @param country    free text or flag emoji
 * @param additional statically configured host, never retired
 * @param badHost    known to block health checks
 */
public record ListedInstance(
    String  domain,
    String  url,
    String  country,
    boolean additional,
    boolean badHost
) {

    public ListedInstance withBadHost(boolean flag) {
        return new ListedInstance(domain, url, country, additional, flag);
    }
}
