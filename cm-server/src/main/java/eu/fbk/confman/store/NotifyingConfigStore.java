package eu.fbk.confman.store;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.data.ConfigValue;

/**
 * A {@code ConfigStore} wrapper that reports the full configuration to a {@link ChangeListener}
 * after every successful change. Listener failures are logged and do not undo the change.
 */
public final class NotifyingConfigStore extends ForwardingConfigStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(NotifyingConfigStore.class);

    private final ConfigStore delegate;

    private final ChangeListener listener;

    public NotifyingConfigStore(final ConfigStore delegate, final ChangeListener listener) {
        this.delegate = Preconditions.checkNotNull(delegate);
        this.listener = Preconditions.checkNotNull(listener);
    }

    @Override
    protected ConfigStore delegate() {
        return this.delegate;
    }

    @Override
    public void set(final String key, @Nullable final ConfigValue value)
            throws ConfigurationException {
        super.set(key, value);
        try {
            this.listener.configurationChanged(getName(), getAll());
        } catch (final Throwable ex) {
            LOGGER.error("Could not notify change of configuration " + getName(), ex);
        }
    }

}
