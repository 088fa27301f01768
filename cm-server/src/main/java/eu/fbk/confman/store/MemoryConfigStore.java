package eu.fbk.confman.store;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.ConfigurationException.Kind;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

/**
 * A {@code ConfigStore} keeping the configuration in memory. Not thread-safe.
 */
public final class MemoryConfigStore implements ConfigStore {

    private final String name;

    private ConfigMap configuration;

    public MemoryConfigStore(final String name, final ConfigMap configuration) {
        Preconditions.checkArgument(!name.isEmpty(), "Empty application name");
        this.name = name;
        this.configuration = Preconditions.checkNotNull(configuration);
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public ConfigMap getAll() {
        return this.configuration;
    }

    @Override
    public void set(final String key, @Nullable final ConfigValue value)
            throws ConfigurationException {
        if (key == null || key.isEmpty()) {
            throw new ConfigurationException(Kind.INVALID_ARGUMENT, "Empty key");
        }
        if (value == null) {
            throw new ConfigurationException(Kind.INVALID_ARGUMENT, "Missing value for key '"
                    + key + "'");
        }
        this.configuration = this.configuration.with(key, value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + this.name + "]";
    }

}
