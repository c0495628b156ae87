package com.mirrorwatch.common.retention;

import java.util.Comparator;
import java.util.List;

/**
 * Decides which error records of one instance fall outside the retention cap.
 *
 * <p>Records are ordered newest first ({@code occurredAt} desc, then {@code id} desc);
 * the first {@code cap} survive, the rest are evicted.
 */
public final class ErrorRetentionPolicy {

    static final Comparator<ErrorRecordRef> NEWEST_FIRST = Comparator
        .comparing(ErrorRecordRef::occurredAt, Comparator.reverseOrder())
        .thenComparing(ErrorRecordRef::id, Comparator.reverseOrder());

    private ErrorRetentionPolicy() {}

    /**
     * @return ids to delete; empty when the instance is within the cap
     * @throws IllegalArgumentException when {@code cap} is negative
     */
    public static List<Long> evictions(List<ErrorRecordRef> records, int cap) {
        if (cap < 0) {
            throw new IllegalArgumentException("Retention cap must not be negative: " + cap);
        }
        if (records.size() <= cap) {
            return List.of();
        }
        return records.stream()
            .sorted(NEWEST_FIRST)
            .skip(cap)
            .map(ErrorRecordRef::id)
            .toList();
    }
}
