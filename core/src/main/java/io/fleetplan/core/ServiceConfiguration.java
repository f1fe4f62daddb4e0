// file: core/src/main/java/io/fleetplan/core/ServiceConfiguration.java
package io.fleetplan.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Count of service instances, grouped by {@link ConfigKey}.
 * <p>
 * For most services the key is just the image, giving a count of instances at
 * each version. For sharded services the key is (shard, image), so counts are
 * kept per shard and version. The multiset itself is agnostic to the fields;
 * they are fixed at construction time.
 * <p>
 * One multiset is kept per service for the whole datacenter, and one per
 * (service, compute node). Both are built once through {@link Builder} and are
 * read-only afterwards.
 */
public final class ServiceConfiguration {

    private final List<ConfigField> fields;
    // Insertion-ordered; counts are always >= 0.
    private final Map<ConfigKey, Integer> counts;

    private ServiceConfiguration(List<ConfigField> fields, Map<ConfigKey, Integer> counts) {
        this.fields = fields;
        this.counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public static Builder builder(List<ConfigField> fields) {
        return new Builder(fields);
    }

    public static ServiceConfiguration empty(List<ConfigField> fields) {
        return new Builder(fields).build();
    }

    public List<ConfigField> fields() {
        return fields;
    }

    /** Count for {@code key}, or 0 if the key was never added. */
    public int get(ConfigKey key) {
        checkArity(fields, key);
        return counts.getOrDefault(key, 0);
    }

    public boolean has(ConfigKey key) {
        checkArity(fields, key);
        return counts.containsKey(key);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public int total() {
        int sum = 0;
        for (int c : counts.values()) {
            sum += c;
        }
        return sum;
    }

    /** All (key, count) pairs in insertion order. */
    public Map<ConfigKey, Integer> entries() {
        return counts;
    }

    /** All (key, count) pairs ordered by {@code order}; ties keep insertion order. */
    public List<Map.Entry<ConfigKey, Integer>> sorted(Comparator<ConfigKey> order) {
        List<Map.Entry<ConfigKey, Integer>> out = new ArrayList<>(counts.entrySet());
        out.sort(Map.Entry.comparingByKey(order));
        return out;
    }

    /**
     * Nested plain-map view keyed by each field in turn, ending in
     * {@code {image: count}}, e.g. {@code {"1": {"img-a": 2}}} for a sharded
     * service. This is the shape operators write in configuration files.
     */
    public Map<String, Object> legacySummary() {
        return nest(List.copyOf(counts.entrySet()), 0);
    }

    // Every key has the same arity, so a level holds either images or groups.
    private static Map<String, Object> nest(List<Map.Entry<ConfigKey, Integer>> rows, int depth) {
        Map<String, Object> level = new LinkedHashMap<>();
        Map<String, List<Map.Entry<ConfigKey, Integer>>> groups = new LinkedHashMap<>();
        for (Map.Entry<ConfigKey, Integer> row : rows) {
            ConfigKey key = row.getKey();
            if (depth == key.size() - 1) {
                level.put(key.image(), row.getValue());
            } else {
                groups.computeIfAbsent(key.get(depth), k -> new ArrayList<>()).add(row);
            }
        }
        groups.forEach((value, group) -> level.put(value, nest(group, depth + 1)));
        return level;
    }

    /**
     * List view: one {@code {shard?, image_uuid, count}} map per key, using the
     * fields' external names.
     */
    public List<Map<String, Object>> summary() {
        List<Map<String, Object>> out = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                row.put(fields.get(i).externalName(), key.get(i));
            }
            row.put("count", count);
            out.add(row);
        });
        return out;
    }

    @Override
    public String toString() {
        return "ServiceConfiguration" + counts;
    }

    static void checkArity(List<ConfigField> fields, ConfigKey key) {
        Objects.requireNonNull(key, "key");
        if (key.size() != fields.size()) {
            throw new IllegalArgumentException(
                    "config key " + key + " does not match fields " + fields);
        }
    }

    /**
     * Append-only builder. Counts may only grow while building.
     */
    public static final class Builder {
        private final List<ConfigField> fields;
        private final Map<ConfigKey, Integer> counts = new LinkedHashMap<>();

        private Builder(List<ConfigField> fields) {
            Objects.requireNonNull(fields, "fields");
            if (fields.isEmpty() || fields.get(fields.size() - 1) != ConfigField.IMAGE) {
                throw new IllegalArgumentException("fields must end with IMAGE: " + fields);
            }
            this.fields = List.copyOf(fields);
        }

        public Builder incr(ConfigKey key) {
            return incr(key, 1);
        }

        public Builder incr(ConfigKey key, int count) {
            checkArity(fields, key);
            if (count < 0) {
                throw new IllegalArgumentException("count must be >= 0, got " + count);
            }
            counts.merge(key, count, Integer::sum);
            return this;
        }

        public ServiceConfiguration build() {
            return new ServiceConfiguration(fields, counts);
        }
    }
}
