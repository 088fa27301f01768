package eu.fbk.confman.store;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

/**
 * A {@code ConfigStore} that forwards all its method calls to another {@code ConfigStore}.
 * <p>
 * This class provides a starting point for implementing the decorator pattern on top of the
 * {@code ConfigStore} interface. Subclasses must implement method {@link #delegate()} and
 * override the methods of {@code ConfigStore} they want to decorate.
 * </p>
 */
public abstract class ForwardingConfigStore extends ForwardingObject implements ConfigStore {

    @Override
    protected abstract ConfigStore delegate();

    @Override
    public String getName() {
        return delegate().getName();
    }

    @Override
    public ConfigMap getAll() {
        return delegate().getAll();
    }

    @Override
    public void set(final String key, @Nullable final ConfigValue value)
            throws ConfigurationException {
        delegate().set(key, value);
    }

}
