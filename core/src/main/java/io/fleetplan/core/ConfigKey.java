// file: core/src/main/java/io/fleetplan/core/ConfigKey.java
package io.fleetplan.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable composite key bucketing instances of one service.
 * <p>
 * Values follow the service's field order (see {@link ServiceCatalog#configFields}):
 * {@code [image]} for most services, {@code [shard, image]} for sharded ones.
 * <p>
 * Design:
 *  - Value object: equals/hashCode over the ordered values.
 *  - Never compared across services; {@link ServiceConfiguration} checks arity.
 */
public final class ConfigKey {

    private final List<String> values;

    private ConfigKey(List<String> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("config key must have at least an image");
        }
        for (String v : values) {
            Objects.requireNonNull(v, "config key values must not be null");
        }
        this.values = List.copyOf(values);
    }

    public static ConfigKey of(String... values) {
        return new ConfigKey(Arrays.asList(values));
    }

    public static ConfigKey of(List<String> values) {
        return new ConfigKey(values);
    }

    public List<String> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public String get(int i) {
        return values.get(i);
    }

    /** The image identifier (always the last field). */
    public String image() {
        return values.get(values.size() - 1);
    }

    /**
     * Every value except the image. Two keys with the same partition describe
     * interchangeable instances that differ only by image (e.g. same shard).
     */
    public List<String> partition() {
        return values.subList(0, values.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigKey other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
