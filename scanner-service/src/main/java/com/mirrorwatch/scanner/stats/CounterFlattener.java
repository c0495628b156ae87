package com.mirrorwatch.scanner.stats;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flattens the integral leaves of a JSON object into dotted counter names:
 * <pre>
 *   {"accounts": {"total": 12, "limited": 3}, "requests": {"total": 900}}
 *     → accounts.limited=3, accounts.total=12, requests.total=900
 * </pre>
 * Strings, booleans, fractions and arrays are skipped.
 */
final class CounterFlattener {

    private CounterFlattener() {}

    static Map<String, Long> flatten(JsonNode root) {
        Map<String, Long> counters = new TreeMap<>();
        if (root != null && root.isObject()) {
            walk("", root, counters);
        }
        return counters;
    }

    private static void walk(String prefix, JsonNode node, Map<String, Long> counters) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                walk(name, value, counters);
            } else if (value.isIntegralNumber()) {
                counters.put(name, value.longValue());
            }
        }
    }
}
