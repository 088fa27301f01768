package eu.fbk.confman.data;

import java.io.Serializable;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

/**
 * An immutable mapping from configuration keys to {@link ConfigValue}s.
 * <p>
 * Keys are non-empty strings. Entries are kept sorted by key, which makes iteration, string
 * rendering and JSON serialization deterministic; insertion order is not retained. Modified
 * copies are obtained with {@link #with(String, ConfigValue)} or through a {@link Builder}.
 * </p>
 */
public final class ConfigMap implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final ConfigMap EMPTY = new ConfigMap(
            ImmutableSortedMap.<String, ConfigValue>of());

    private final ImmutableSortedMap<String, ConfigValue> entries;

    private ConfigMap(final ImmutableSortedMap<String, ConfigValue> entries) {
        this.entries = entries;
    }

    public static ConfigMap of() {
        return EMPTY;
    }

    public static ConfigMap copyOf(final Map<String, ?> map) {
        if (map.isEmpty()) {
            return EMPTY;
        }
        final Builder builder = builder();
        for (final Map.Entry<String, ?> entry : map.entrySet()) {
            builder.put(entry.getKey(), ConfigValue.valueOf(entry.getValue()));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public ConfigValue get(final String key) {
        return this.entries.get(key);
    }

    public boolean containsKey(final String key) {
        return this.entries.containsKey(key);
    }

    public Set<String> keySet() {
        return this.entries.keySet();
    }

    public int size() {
        return this.entries.size();
    }

    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    /**
     * Returns an immutable {@code Map} view of this configuration map.
     *
     * @return the entries, sorted by key
     */
    public Map<String, ConfigValue> asMap() {
        return this.entries;
    }

    /**
     * Returns a copy of this map where the key specified is bound to the value specified.
     *
     * @param key
     *            the key, not empty
     * @param value
     *            the value
     * @return the resulting map
     */
    public ConfigMap with(final String key, final ConfigValue value) {
        return builder().putAll(this).put(key, value).build();
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof ConfigMap)) {
            return false;
        }
        return this.entries.equals(((ConfigMap) object).entries);
    }

    @Override
    public int hashCode() {
        return this.entries.hashCode();
    }

    @Override
    public String toString() {
        return "{" + Joiner.on(", ").withKeyValueSeparator("=").join(this.entries) + "}";
    }

    /**
     * Builder of {@code ConfigMap}s. A later {@code put} for the same key replaces the value of
     * an earlier one.
     */
    public static final class Builder {

        private final Map<String, ConfigValue> entries;

        Builder() {
            this.entries = Maps.newTreeMap();
        }

        public Builder put(final String key, final ConfigValue value) {
            Preconditions.checkArgument(!key.isEmpty(), "Empty key");
            this.entries.put(key, Preconditions.checkNotNull(value));
            return this;
        }

        public Builder put(final String key, final String value) {
            return put(key, ConfigValue.of(value));
        }

        public Builder put(final String key, final long value) {
            return put(key, ConfigValue.of(value));
        }

        public Builder put(final String key, final double value) {
            return put(key, ConfigValue.of(value));
        }

        public Builder put(final String key, final boolean value) {
            return put(key, ConfigValue.of(value));
        }

        public Builder putAll(final ConfigMap map) {
            this.entries.putAll(map.entries);
            return this;
        }

        public ConfigMap build() {
            return this.entries.isEmpty() ? EMPTY : new ConfigMap(
                    ImmutableSortedMap.copyOf(this.entries));
        }

    }

}
