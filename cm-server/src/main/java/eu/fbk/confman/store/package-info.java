/**
 * Per-application configuration stores.
 * <p>
 * A {@link eu.fbk.confman.store.ConfigStore} holds the configuration of one application. The
 * functionalities of a store are split among decorators that are combined by
 * {@link eu.fbk.confman.store.ConfigStores#open(String, java.nio.file.Path, ChangeListener)}:
 * {@link eu.fbk.confman.store.MemoryConfigStore} keeps the data,
 * {@link eu.fbk.confman.store.NotifyingConfigStore} reports every change,
 * {@link eu.fbk.confman.store.PersistentConfigStore} writes it to disk,
 * {@link eu.fbk.confman.store.LoggingConfigStore} traces operations and
 * {@link eu.fbk.confman.store.SynchronizedConfigStore} serializes them.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.store;

