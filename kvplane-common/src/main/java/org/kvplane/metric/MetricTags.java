package org.kvplane.metric;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable metric tags, kept sorted by key
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MetricTags {

    private static final MetricTags EMPTY = new MetricTags(Collections.emptyMap());

    private final Map<String, String> tags;

    private MetricTags(Map<String, String> tags) {
        this.tags = tags;
    }

    /**
     * @param keyValues key1, value1, key2, value2, ... pairs with a null key or value are skipped
     */
    public static MetricTags of(String... keyValues) {
        if (keyValues == null || keyValues.length == 0) {
            return EMPTY;
        }
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Key-value pairs must be even number of arguments");
        }
        Map<String, String> tags = new TreeMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            String key = keyValues[i];
            String value = keyValues[i + 1];
            if (key != null && value != null) {
                tags.put(key, value);
            }
        }
        return new MetricTags(Collections.unmodifiableMap(tags));
    }
}
