package eu.fbk.confman;

import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

/**
 * The configuration of one application, as published by the configuration manager.
 * <p>
 * This interface is implemented both on the server side, where the configuration is owned and
 * stored, and on the client side, where calls are forwarded to a remote configuration manager
 * over the bus. Implementations are thread-safe. Any successful change causes a
 * {@value Names#CONFIGURATION_CHANGED} notification carrying the full resulting configuration to
 * be sent to subscribers.
 * </p>
 */
public interface Configuration {

    /**
     * Returns the name of the application this configuration belongs to.
     *
     * @return the application name
     */
    String getApplicationName();

    /**
     * Returns a snapshot of all the key/value pairs of the configuration. The returned map is
     * immutable and not affected by later changes.
     *
     * @return the current configuration
     * @throws ConfigurationException
     *             in case the configuration cannot be retrieved (remote implementations only)
     */
    ConfigMap getConfiguration() throws ConfigurationException;

    /**
     * Sets one key of the configuration, inserting it or replacing its previous value. No check
     * is done on the type of a previous value or on the range of the new one.
     *
     * @param key
     *            the key, not empty
     * @param value
     *            the value, not null
     * @throws ConfigurationException
     *             with kind {@code INVALID_ARGUMENT} in case the key is empty or the value is
     *             missing, with kind {@code TYPE_ERROR} in case the value is not a supported
     *             scalar, or with kind {@code IPC_CONNECTION_ERROR} in case a remote configuration
     *             manager cannot be reached
     */
    void changeConfiguration(String key, ConfigValue value) throws ConfigurationException;

}
