package eu.fbk.confman.store;

import eu.fbk.confman.data.ConfigMap;

/**
 * Receives the configuration resulting from every successful change of a store.
 */
public interface ChangeListener {

    void configurationChanged(String name, ConfigMap configuration) throws Exception;

}
