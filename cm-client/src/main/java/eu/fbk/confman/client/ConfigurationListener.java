package eu.fbk.confman.client;

import eu.fbk.confman.data.ConfigMap;

/**
 * Receives the configuration snapshots published after every change of an application
 * configuration.
 * <p>
 * Implementations are invoked on the delivery thread of the bus, must return quickly and must not
 * call back the configuration manager.
 * </p>
 */
public interface ConfigurationListener {

    void configurationChanged(ConfigMap configuration);

}
