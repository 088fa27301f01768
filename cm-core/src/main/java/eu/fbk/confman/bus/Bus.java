package eu.fbk.confman.bus;

import java.io.Closeable;

import javax.annotation.Nullable;

/**
 * A message bus connection.
 * <p>
 * Implementations are thread-safe. Method calls may be served concurrently, while signals are
 * delivered to each subscription in the order they are emitted. After {@link #close()} every
 * operation fails with an {@code IllegalStateException}, while {@code close()} itself may be
 * called again with no effect.
 * </p>
 */
public interface Bus extends Closeable {

    /**
     * Claims a well-known name on the bus.
     *
     * @param name
     *            the name
     * @throws BusException
     *             with name {@link BusException#ADDRESS_IN_USE} if already owned
     */
    void requestName(String name) throws BusException;

    /**
     * Releases a name previously claimed with {@link #requestName(String)}.
     *
     * @param name
     *            the name
     * @throws BusException
     *             on failure
     */
    void releaseName(String name) throws BusException;

    /**
     * Exports an object implementing an interface.
     *
     * @param path
     *            the object path
     * @param interfaceName
     *            the interface name
     * @param handler
     *            the handler of the calls to the object
     * @return the registration, to be used for withdrawing the object
     * @throws BusException
     *             with name {@link BusException#ADDRESS_IN_USE} if the same interface is already
     *             exported at that path
     */
    Registration exportObject(ObjectPath path, String interfaceName, MethodHandler handler)
            throws BusException;

    /**
     * Performs a method call, blocking until its reply is received.
     *
     * @param call
     *            the call
     * @return the reply, null if the method returns nothing
     * @throws BusException
     *             if the call cannot be delivered or answered, or if the handler fails
     */
    @Nullable
    Object call(MethodCall call) throws BusException;

    /**
     * Emits a signal. The method returns once the signal is queued for delivery.
     *
     * @param signal
     *            the signal
     * @throws BusException
     *             on failure
     */
    void emitSignal(Signal signal) throws BusException;

    /**
     * Subscribes to the signals matching a filter. Every signal emitted after this method
     * returns and matching the filter is delivered to the handler.
     *
     * @param match
     *            the filter
     * @param handler
     *            the handler
     * @return the subscription, to be used for cancelling it
     * @throws BusException
     *             on failure
     */
    Subscription subscribe(SignalMatch match, SignalHandler handler) throws BusException;

    /**
     * {@inheritDoc} Releases the names, objects and subscriptions of this connection.
     */
    @Override
    void close();

}
