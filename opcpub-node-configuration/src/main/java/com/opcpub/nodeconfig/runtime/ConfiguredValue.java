package com.opcpub.nodeconfig.runtime;

import java.util.Objects;

/**
 * A per-node setting together with where it came from: explicitly configured for the node, or the
 * process default. Only explicit values are written back to the configuration file.
 *
 * @param <T> value type
 */
public final class ConfiguredValue<T> {

    private final T value;
    private final boolean explicitlySet;

    private ConfiguredValue(T value, boolean explicitlySet) {
        this.value = value;
        this.explicitlySet = explicitlySet;
    }

    public static <T> ConfiguredValue<T> explicit(T value) {
        return new ConfiguredValue<>(Objects.requireNonNull(value, "value"), true);
    }

    public static <T> ConfiguredValue<T> ofDefault(T defaultValue) {
        return new ConfiguredValue<>(defaultValue, false);
    }

    /** Explicit when {@code configured} is non-null, otherwise the default. */
    public static <T> ConfiguredValue<T> resolve(T configured, T defaultValue) {
        return configured != null ? explicit(configured) : ofDefault(defaultValue);
    }

    /** Effective value (configured or default). */
    public T getValue() {
        return value;
    }

    public boolean isExplicitlySet() {
        return explicitlySet;
    }

    /** The value if it was configured explicitly, otherwise null (so it is omitted on export). */
    public T explicitValueOrNull() {
        return explicitlySet ? value : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConfiguredValue<?> that = (ConfiguredValue<?>) o;
        return explicitlySet == that.explicitlySet && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, explicitlySet);
    }

    @Override
    public String toString() {
        return explicitlySet ? String.valueOf(value) : value + " (default)";
    }
}
