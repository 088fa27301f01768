package eu.fbk.confman.store;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

/**
 * A {@code ConfigStore} wrapper that logs calls to the operations of a wrapped
 * {@code ConfigStore} and their execution times.
 * <p>
 * Reads and execution times are logged at DEBUG level, successful changes at INFO level and
 * rejected changes at WARN level, using a logger named after this class. The overhead introduced
 * by this wrapper when DEBUG logging is disabled is negligible.
 * </p>
 */
public final class LoggingConfigStore extends ForwardingConfigStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingConfigStore.class);

    private final ConfigStore delegate;

    public LoggingConfigStore(final ConfigStore delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
    }

    @Override
    protected ConfigStore delegate() {
        return this.delegate;
    }

    @Override
    public ConfigMap getAll() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final ConfigMap result = super.getAll();
            LOGGER.debug("{} - {} keys read in {} ms", this, result.size(),
                    System.currentTimeMillis() - ts);
            return result;
        } else {
            return super.getAll();
        }
    }

    @Override
    public void set(final String key, @Nullable final ConfigValue value)
            throws ConfigurationException {
        final long ts = System.currentTimeMillis();
        try {
            super.set(key, value);
        } catch (final ConfigurationException ex) {
            LOGGER.warn("{} - change of '{}' rejected: {}", this, key, ex.getMessage());
            throw ex;
        }
        LOGGER.info("{} - {} set to {}", this, key, value);
        LOGGER.debug("{} - change of '{}' completed in {} ms", this, key,
                System.currentTimeMillis() - ts);
    }

    @Override
    public String toString() {
        return "ConfigStore[" + getName() + "]";
    }

}
