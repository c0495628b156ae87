package com.mirrorwatch.scanner.upstream;

import com.mirrorwatch.common.model.CommitState;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lineage answers per commit SHA, kept across probe ticks.
 *
 * <p>Every head refresh starts a new epoch. Entries not read or written during the current
 * or the previous epoch are dropped. When the head moves, only {@link CommitState#OUTDATED}
 * answers stay valid: an ancestor of the old head is an ancestor of the new one, every other
 * answer may have changed.
 */
class CommitLineageCache {

    private record Entry(CommitState state, long epoch) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong         epoch   = new AtomicLong();

    Optional<CommitState> get(String sha) {
        String key = key(sha);
        Entry entry = entries.computeIfPresent(key, (k, e) -> new Entry(e.state(), epoch.get()));
        return entry == null ? Optional.empty() : Optional.of(entry.state());
    }

    void put(String sha, CommitState state) {
        entries.put(key(sha), new Entry(state, epoch.get()));
    }

    /** @return entries remaining after pruning */
    int advanceEpoch(boolean headChanged) {
        long current = epoch.incrementAndGet();
        entries.entrySet().removeIf(e ->
            e.getValue().epoch() < current - 1
            || (headChanged && e.getValue().state() != CommitState.OUTDATED));
        return entries.size();
    }

    int size() {
        return entries.size();
    }

    private static String key(String sha) {
        return sha.toLowerCase(Locale.ROOT);
    }
}
