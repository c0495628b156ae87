package com.mirrorwatch.common.registry;

import com.mirrorwatch.common.model.ListedInstance;
import com.mirrorwatch.common.parser.HostNames;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diffs the merged registry listing against the stored instances.
 *
 * <p>Pure static planner: no I/O, no logging. Rows are never deleted. A row absent
 * from the listing accumulates {@code missedPasses}; it is disabled only when
 * {@code retireAfterMisses > 0} and the count reaches it.
 */
public final class ReconciliationPlanner {

    private ReconciliationPlanner() {}

    /**
     * Unions the parsed registry listing with the statically configured hosts and applies
     * the bad host flags. Configured hosts already on the wiki keep the wiki's url and country.
     */
    public static Map<String, ListedInstance> mergeListing(Map<String, ListedInstance> parsed,
                                                           Collection<String> additionalHosts,
                                                           String additionalCountry,
                                                           Collection<String> badHosts) {
        Map<String, ListedInstance> merged = new LinkedHashMap<>(parsed);

        for (String raw : additionalHosts) {
            String domain = HostNames.normalize(raw);
            String url    = HostNames.toBaseUrl(raw);
            if (domain == null || url == null) continue;
            ListedInstance listed = merged.get(domain);
            merged.put(domain, listed == null
                ? new ListedInstance(domain, url, additionalCountry, true, false)
                : new ListedInstance(domain, listed.url(), listed.country(), true, listed.badHost()));
        }

        Set<String> bad = new HashSet<>();
        for (String raw : badHosts) {
            String domain = HostNames.normalize(raw);
            if (domain != null) bad.add(domain);
        }
        merged.replaceAll((domain, listed) -> listed.withBadHost(bad.contains(domain)));
        return merged;
    }

    public static ReconciliationPlan plan(Map<String, ListedInstance> listing,
                                          Collection<KnownInstance> known,
                                          int retireAfterMisses) {
        List<ListedInstance> additions         = new ArrayList<>();
        List<KnownInstance>  updates           = new ArrayList<>();
        List<String>         retained          = new ArrayList<>();
        List<String>         reactivated       = new ArrayList<>();
        List<String>         removedCandidates = new ArrayList<>();
        List<String>         retired           = new ArrayList<>();

        Map<String, KnownInstance> byDomain = new LinkedHashMap<>();
        for (KnownInstance k : known) {
            byDomain.put(k.domain(), k);
        }

        // ── listed domains ──
        for (ListedInstance listed : listing.values()) {
            KnownInstance existing = byDomain.get(listed.domain());
            if (existing == null) {
                additions.add(listed);
                continue;
            }
            KnownInstance refreshed = new KnownInstance(existing.id(), existing.domain(),
                listed.url(), listed.country(), listed.additional(), listed.badHost(), true, 0);
            if (existing.enabled()) {
                retained.add(existing.domain());
            } else {
                reactivated.add(existing.domain());
            }
            if (!refreshed.equals(existing)) {
                updates.add(refreshed);
            }
        }

        // ── absent domains ──
        for (KnownInstance existing : byDomain.values()) {
            if (listing.containsKey(existing.domain()) || !existing.enabled()) {
                continue;
            }
            removedCandidates.add(existing.domain());
            int misses = existing.missedPasses() + 1;
            boolean retire = retireAfterMisses > 0 && misses >= retireAfterMisses;
            if (retire) {
                retired.add(existing.domain());
            }
            updates.add(new KnownInstance(existing.id(), existing.domain(), existing.url(),
                existing.country(), false, existing.badHost(), !retire, misses));
        }

        return new ReconciliationPlan(List.copyOf(additions), List.copyOf(updates),
            List.copyOf(retained), List.copyOf(reactivated),
            List.copyOf(removedCandidates), List.copyOf(retired));
    }
}
