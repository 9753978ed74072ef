package com.specunit.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered key-value annotations attached to an example group or an example.
 * Keys keep their insertion order; values may be null.
 */
public class Metadata extends LinkedHashMap<String, Object> {

    public Metadata() {
        super();
    }

    public Metadata(Map<String, ?> source) {
        super(source);
    }

    /**
     * Build a record from alternating keys and values.
     */
    public static Metadata metadata(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " arguments");
        }
        Metadata metadata = new Metadata();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (!(keysAndValues[i] instanceof String)) {
                throw new IllegalArgumentException("Metadata keys must be strings: " + keysAndValues[i]);
            }
            metadata.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return metadata;
    }

    /**
     * The nested record stored under {@code key}, or null when there is none.
     */
    public Metadata nested(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Metadata) {
            return (Metadata) value;
        }
        throw new IllegalStateException("Metadata key '" + key + "' does not hold a nested record");
    }

    public String getString(String key) {
        Object value = get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Add the entries of {@code other} whose keys are not present yet.
     */
    public Metadata mergeAbsent(Map<String, ?> other) {
        other.forEach(this::putIfAbsent);
        return this;
    }

    /**
     * Copy this record; nested records are copied too so the snapshot does not follow later writes.
     */
    public Metadata copy() {
        Metadata copy = new Metadata();
        forEach((key, value) -> copy.put(key, value instanceof Metadata ? ((Metadata) value).copy() : value));
        return copy;
    }
}
