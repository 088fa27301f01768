package eu.fbk.confman.server;

import java.nio.file.Path;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.Configuration;
import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.ConfigurationException.Kind;
import eu.fbk.confman.Names;
import eu.fbk.confman.bus.Bus;
import eu.fbk.confman.bus.BusException;
import eu.fbk.confman.bus.MethodCall;
import eu.fbk.confman.bus.MethodHandler;
import eu.fbk.confman.bus.ObjectPath;
import eu.fbk.confman.bus.Registration;
import eu.fbk.confman.bus.Signal;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;
import eu.fbk.confman.internal.Logging;
import eu.fbk.confman.store.ChangeListener;
import eu.fbk.confman.store.ConfigStore;
import eu.fbk.confman.store.ConfigStores;

/**
 * The bus endpoint publishing the configuration of one application.
 * <p>
 * The endpoint serves the {@value Names#GET_CONFIGURATION} and
 * {@value Names#CHANGE_CONFIGURATION} methods of the configuration interface at the object path
 * of its application, and emits {@value Names#CONFIGURATION_CHANGED} with the full configuration
 * after every successful change. Changes are applied to a store obtained from
 * {@link ConfigStores#open(String, Path, ChangeListener)}, so that the signal is emitted and the
 * file written while holding the lock of the application.
 * </p>
 */
public final class ApplicationEndpoint implements Configuration, MethodHandler, ChangeListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApplicationEndpoint.class);

    private final Bus bus;

    private final String interfaceName;

    private final ObjectPath path;

    private final Path file;

    private final ConfigStore store;

    @Nullable
    private Registration registration;

    /**
     * Creates the endpoint of an application, loading its configuration file. The endpoint is
     * not reachable until {@link #export()} is called.
     *
     * @param bus
     *            the bus where to publish the endpoint
     * @param serviceName
     *            the service name, determining object path and interface name
     * @param applicationName
     *            the application name
     * @param file
     *            the configuration file
     * @throws ConfigurationException
     *             if the configuration file cannot be loaded
     */
    public ApplicationEndpoint(final Bus bus, final String serviceName,
            final String applicationName, final Path file) throws ConfigurationException {
        this.bus = Preconditions.checkNotNull(bus);
        this.interfaceName = Names.interfaceName(serviceName);
        this.path = Names.applicationPath(serviceName, applicationName);
        this.file = file;
        this.store = ConfigStores.open(applicationName, file, this);
        this.registration = null;
    }

    @Override
    public String getApplicationName() {
        return this.store.getName();
    }

    public ObjectPath getPath() {
        return this.path;
    }

    public Path getFile() {
        return this.file;
    }

    public synchronized void export() throws BusException {
        Preconditions.checkState(this.registration == null, "Already exported");
        this.registration = this.bus.exportObject(this.path, this.interfaceName, this);
        LOGGER.debug("Application {} exported at {}", getApplicationName(), this.path);
    }

    public synchronized void unexport() {
        if (this.registration != null) {
            this.registration.unregister();
            this.registration = null;
        }
    }

    @Override
    public ConfigMap getConfiguration() {
        return this.store.getAll();
    }

    @Override
    public void changeConfiguration(final String key, @Nullable final ConfigValue value)
            throws ConfigurationException {
        this.store.set(key, value);
    }

    @Override
    public void configurationChanged(final String name, final ConfigMap configuration)
            throws BusException {
        emit(configuration);
    }

    /**
     * Emits the {@value Names#CONFIGURATION_CHANGED} signal for this application.
     *
     * @param configuration
     *            the full configuration carried by the signal
     * @throws BusException
     *             if the signal cannot be emitted
     */
    public void emit(final ConfigMap configuration) throws BusException {
        this.bus.emitSignal(new Signal(this.path, this.interfaceName,
                Names.CONFIGURATION_CHANGED, configuration));
    }

    @Nullable
    @Override
    public Object handle(final MethodCall call) throws Exception {
        final String oldContext = Logging.setContext(getApplicationName());
        try {
            final String member = call.getMember();
            if (member.equals(Names.GET_CONFIGURATION)) {
                return getConfiguration();
            } else if (member.equals(Names.CHANGE_CONFIGURATION)) {
                handleChange(call);
                return null;
            }
            throw new BusException(BusException.UNKNOWN_METHOD, "No such method " + member
                    + " in interface " + this.interfaceName);
        } finally {
            Logging.setContext(oldContext);
        }
    }

    private void handleChange(final MethodCall call) throws ConfigurationException {
        final int size = call.getArgs().size();
        final Object key = size > 0 ? call.getArgs().get(0) : null;
        final Object value = size > 1 ? call.getArgs().get(1) : null;
        if (!(key instanceof String)) {
            throw new ConfigurationException(Kind.INVALID_ARGUMENT, "Missing key argument");
        } else if (value != null && !(value instanceof ConfigValue)) {
            throw new ConfigurationException(Kind.TYPE_ERROR, "Unsupported value " + value
                    + " for key '" + key + "'");
        }
        changeConfiguration((String) key, (ConfigValue) value);
    }

    @Override
    public String toString() {
        return "ApplicationEndpoint[" + getApplicationName() + "]";
    }

}
