package eu.fbk.confman.client;

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
import eu.fbk.confman.bus.ObjectPath;
import eu.fbk.confman.bus.Signal;
import eu.fbk.confman.bus.SignalHandler;
import eu.fbk.confman.bus.SignalMatch;
import eu.fbk.confman.bus.Subscription;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

/**
 * Client-side view of the configuration of one application, published by a remote configuration
 * manager.
 * <p>
 * Calls are forwarded over the {@code Bus} supplied at construction time. Failures reported by
 * the configuration manager are re-thrown with their original {@link Kind}; any other failure of
 * the bus is reported as {@link Kind#IPC_CONNECTION_ERROR}.
 * </p>
 */
public final class ConfigurationProxy implements Configuration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationProxy.class);

    private final Bus bus;

    private final String serviceName;

    private final String applicationName;

    private final ObjectPath path;

    private final String interfaceName;

    public ConfigurationProxy(final Bus bus, final String serviceName,
            final String applicationName) {
        this.bus = Preconditions.checkNotNull(bus);
        this.serviceName = Preconditions.checkNotNull(serviceName);
        this.applicationName = Preconditions.checkNotNull(applicationName);
        this.path = Names.applicationPath(serviceName, applicationName);
        this.interfaceName = Names.interfaceName(serviceName);
    }

    @Override
    public String getApplicationName() {
        return this.applicationName;
    }

    public ObjectPath getPath() {
        return this.path;
    }

    @Override
    public ConfigMap getConfiguration() throws ConfigurationException {
        final Object result = invoke(Names.GET_CONFIGURATION);
        if (!(result instanceof ConfigMap)) {
            throw new ConfigurationException(Kind.IPC_CONNECTION_ERROR, "Unexpected reply to "
                    + Names.GET_CONFIGURATION + ": " + result);
        }
        return (ConfigMap) result;
    }

    @Override
    public void changeConfiguration(final String key, @Nullable final ConfigValue value)
            throws ConfigurationException {
        Preconditions.checkNotNull(key);
        if (value == null) {
            invoke(Names.CHANGE_CONFIGURATION, key);
        } else {
            invoke(Names.CHANGE_CONFIGURATION, key, value);
        }
    }

    /**
     * Subscribes to the configuration snapshots published after every change. Once this method
     * returns, no later change is missed by the listener.
     *
     * @param listener
     *            the listener to notify
     * @return the subscription, to be cancelled when notifications are no more needed
     * @throws ConfigurationException
     *             with kind {@code IPC_CONNECTION_ERROR} in case the subscription fails
     */
    public Subscription subscribe(final ConfigurationListener listener)
            throws ConfigurationException {
        Preconditions.checkNotNull(listener);
        final SignalMatch match = new SignalMatch(this.path, this.interfaceName,
                Names.CONFIGURATION_CHANGED);
        try {
            return this.bus.subscribe(match, new SignalHandler() {

                @Override
                public void handle(final Signal signal) {
                    final ConfigMap configuration;
                    try {
                        configuration = signal.getArg(0, ConfigMap.class);
                    } catch (final IllegalArgumentException ex) {
                        LOGGER.warn("Ignoring malformed {} notification: {}",
                                Names.CONFIGURATION_CHANGED, ex.getMessage());
                        return;
                    }
                    listener.configurationChanged(configuration);
                }

            });
        } catch (final BusException ex) {
            throw translate(ex);
        }
    }

    @Nullable
    private Object invoke(final String member, final Object... args)
            throws ConfigurationException {
        try {
            return this.bus.call(new MethodCall(this.serviceName, this.path, this.interfaceName,
                    member, args));
        } catch (final BusException ex) {
            throw translate(ex);
        }
    }

    private ConfigurationException translate(final BusException ex) {
        final Kind kind = Kind.forErrorName(ex.getErrorName());
        if (kind != null) {
            return new ConfigurationException(kind, ex.getMessage(), ex);
        }
        return new ConfigurationException(Kind.IPC_CONNECTION_ERROR, "Configuration of "
                + this.applicationName + " not available from " + this.serviceName + ": "
                + ex, ex);
    }

    @Override
    public String toString() {
        return "ConfigurationProxy[" + this.serviceName + ", " + this.applicationName + "]";
    }

}
