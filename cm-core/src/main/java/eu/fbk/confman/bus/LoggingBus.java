package eu.fbk.confman.bus;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@code Bus} wrapper that logs the traffic through a wrapped {@code Bus} and the execution
 * times of calls.
 * <p>
 * Outgoing calls, emitted signals, exported objects and subscriptions are logged via SLF4J (level
 * DEBUG, logger named after this class); failed calls are logged together with their error name.
 * The overhead introduced by this wrapper when logging is disabled is negligible.
 * </p>
 */
public class LoggingBus extends ForwardingBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingBus.class);

    private final Bus delegate;

    /**
     * Creates a new instance for the wrapped {@code Bus} specified.
     *
     * @param delegate
     *            the wrapped {@code Bus}
     */
    public LoggingBus(final Bus delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    protected Bus delegate() {
        return this.delegate;
    }

    @Override
    public void requestName(final String name) throws BusException {
        super.requestName(name);
        LOGGER.debug("{} - name {} acquired", this, name);
    }

    @Override
    public void releaseName(final String name) throws BusException {
        super.releaseName(name);
        LOGGER.debug("{} - name {} released", this, name);
    }

    @Override
    public Registration exportObject(final ObjectPath path, final String interfaceName,
            final MethodHandler handler) throws BusException {
        final Registration registration = super.exportObject(path, interfaceName, handler);
        LOGGER.debug("{} - {} exported at {}", this, interfaceName, path);
        return registration;
    }

    @Nullable
    @Override
    public Object call(final MethodCall call) throws BusException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            try {
                final Object result = super.call(call);
                LOGGER.debug("{} - {} returned {} in {} ms", this, call, result,
                        System.currentTimeMillis() - ts);
                return result;
            } catch (final BusException ex) {
                LOGGER.debug("{} - {} failed in {} ms: {}", this, call,
                        System.currentTimeMillis() - ts, ex.toString());
                throw ex;
            }
        } else {
            return super.call(call);
        }
    }

    @Override
    public void emitSignal(final Signal signal) throws BusException {
        super.emitSignal(signal);
        LOGGER.debug("{} - signal {} emitted", this, signal);
    }

    @Override
    public Subscription subscribe(final SignalMatch match, final SignalHandler handler)
            throws BusException {
        final Subscription subscription = super.subscribe(match, handler);
        LOGGER.debug("{} - subscribed to {}", this, match);
        return subscription;
    }

    @Override
    public void close() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.close();
        }
    }

}
