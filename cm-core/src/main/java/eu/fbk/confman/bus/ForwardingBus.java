package eu.fbk.confman.bus;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;

/**
 * A {@code Bus} that forwards all its method calls to another {@code Bus}.
 * <p>
 * This class provides a starting point for implementing the decorator pattern on top of the
 * {@code Bus} interface. Subclasses must implement method {@link #delegate()} and override the
 * methods of {@code Bus} they want to decorate.
 * </p>
 */
public abstract class ForwardingBus extends ForwardingObject implements Bus {

    @Override
    protected abstract Bus delegate();

    @Override
    public void requestName(final String name) throws BusException {
        delegate().requestName(name);
    }

    @Override
    public void releaseName(final String name) throws BusException {
        delegate().releaseName(name);
    }

    @Override
    public Registration exportObject(final ObjectPath path, final String interfaceName,
            final MethodHandler handler) throws BusException {
        return delegate().exportObject(path, interfaceName, handler);
    }

    @Nullable
    @Override
    public Object call(final MethodCall call) throws BusException {
        return delegate().call(call);
    }

    @Override
    public void emitSignal(final Signal signal) throws BusException {
        delegate().emitSignal(signal);
    }

    @Override
    public Subscription subscribe(final SignalMatch match, final SignalHandler handler)
            throws BusException {
        return delegate().subscribe(match, handler);
    }

    @Override
    public void close() {
        delegate().close();
    }

}
