package eu.fbk.confman.store;

import javax.annotation.Nullable;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

/**
 * The configuration of one application, held by the broker.
 * <p>
 * Whether a store is thread-safe depends on the implementation; stores obtained from
 * {@link ConfigStores#open(String, java.nio.file.Path, ChangeListener)} are.
 * </p>
 */
public interface ConfigStore {

    /**
     * Returns the name of the application the configuration belongs to.
     *
     * @return the application name
     */
    String getName();

    /**
     * Returns a snapshot of the configuration. The snapshot is immutable and does not reflect
     * later changes.
     *
     * @return the current configuration
     */
    ConfigMap getAll();

    /**
     * Inserts or replaces a key. No check is done on the type of a previous value.
     *
     * @param key
     *            the key, not empty
     * @param value
     *            the value, not null
     * @throws ConfigurationException
     *             with kind {@code INVALID_ARGUMENT} if the key is empty or the value is null
     */
    void set(String key, @Nullable ConfigValue value) throws ConfigurationException;

}
