package eu.fbk.confman.store;

import java.nio.file.Path;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.data.ConfigFile;

/**
 * Factory of the thread-safe, persistent and notifying {@code ConfigStore}s used by the broker.
 */
public final class ConfigStores {

    private ConfigStores() {
    }

    /**
     * Opens the store of an application, loading its configuration from a file. On every
     * successful change, the resulting configuration is first passed to the listener and then
     * written back to the file, both while holding the lock of the store.
     *
     * @param name
     *            the application name
     * @param file
     *            the configuration file
     * @param listener
     *            the listener notified of changes
     * @return the opened store
     * @throws ConfigurationException
     *             if the file cannot be loaded (see {@link ConfigFile#load(Path)})
     */
    public static ConfigStore open(final String name, final Path file,
            final ChangeListener listener) throws ConfigurationException {
        ConfigStore store = new MemoryConfigStore(name, ConfigFile.load(file));
        store = new NotifyingConfigStore(store, listener);
        store = new PersistentConfigStore(store, file);
        store = new LoggingConfigStore(store);
        return new SynchronizedConfigStore(store);
    }

}
