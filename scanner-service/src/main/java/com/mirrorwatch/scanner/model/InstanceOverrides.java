package com.mirrorwatch.scanner.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Resolved overrides of one instance. Unknown keys and blank values are ignored.
 */
public final class InstanceOverrides {

    private static final Logger log = LoggerFactory.getLogger(InstanceOverrides.class);

    public static final InstanceOverrides NONE = new InstanceOverrides(Map.of());

    private final Map<OverrideKey, String> values;

    private InstanceOverrides(Map<OverrideKey, String> values) {
        this.values = values;
    }

    public static InstanceOverrides of(Collection<InstanceOverride> rows) {
        if (rows == null || rows.isEmpty()) {
            return NONE;
        }
        Map<OverrideKey, String> values = new EnumMap<>(OverrideKey.class);
        for (InstanceOverride row : rows) {
            if (row.getOverrideValue() == null || row.getOverrideValue().isBlank()) continue;
            OverrideKey.fromKey(row.getOverrideKey()).ifPresentOrElse(
                key -> values.put(key, row.getOverrideValue().trim()),
                () -> log.warn("Ignoring unknown override. instanceId={} key={}",
                               row.getInstanceId(), row.getOverrideKey()));
        }
        return new InstanceOverrides(values);
    }

    /** The override value, or {@code fallback} when none is set. */
    public String getOrDefault(OverrideKey key, String fallback) {
        return values.getOrDefault(key, fallback);
    }

    /** The override value, or {@code null}. */
    public String get(OverrideKey key) {
        return values.get(key);
    }
}
