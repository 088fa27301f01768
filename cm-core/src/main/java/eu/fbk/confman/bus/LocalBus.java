package eu.fbk.confman.bus;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.internal.Util;

/**
 * An in-process {@code Bus}.
 * <p>
 * Method calls are executed concurrently on a pool of dispatcher threads, and the caller waits
 * for the reply at most for the call timeout supplied at construction time (25 seconds by
 * default), after which the call fails with {@link BusException#NO_REPLY}. Signals are delivered
 * by a single delivery thread, so that each subscriber receives them in emission order; handler
 * failures are logged and do not affect other subscribers. A call with a non-null destination
 * fails with {@link BusException#SERVICE_UNKNOWN} unless the destination name has been requested.
 * </p>
 */
public final class LocalBus implements Bus {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalBus.class);

    /** The default call timeout in milliseconds. */
    public static final long DEFAULT_CALL_TIMEOUT = 25000L;

    private static final AtomicInteger COUNTER = new AtomicInteger(0);

    private final String id;

    private final long callTimeout;

    private final Set<String> names;

    private final Map<ObjectPath, Map<String, MethodHandler>> objects;

    private final List<LocalSubscription> subscriptions;

    private final ListeningExecutorService dispatcher;

    private final ListeningExecutorService delivery;

    private final AtomicBoolean closed;

    public LocalBus() {
        this(DEFAULT_CALL_TIMEOUT);
    }

    /**
     * Creates a new instance with the call timeout specified.
     *
     * @param callTimeout
     *            the maximum time in milliseconds a caller waits for a reply, positive
     */
    public LocalBus(final long callTimeout) {
        Preconditions.checkArgument(callTimeout > 0, "Invalid call timeout %s", callTimeout);
        this.id = "LocalBus#" + COUNTER.incrementAndGet();
        this.callTimeout = callTimeout;
        this.names = Sets.newHashSet();
        this.objects = Maps.newHashMap();
        this.subscriptions = new CopyOnWriteArrayList<LocalSubscription>();
        this.dispatcher = Util.newExecutor(this.id.toLowerCase() + "-dispatch-%d", 0);
        this.delivery = Util.newExecutor(this.id.toLowerCase() + "-delivery", 1);
        this.closed = new AtomicBoolean(false);
    }

    private void checkNotClosed() {
        if (this.closed.get()) {
            throw new IllegalStateException(this.id + " already closed");
        }
    }

    @Override
    public synchronized void requestName(final String name) throws BusException {
        Preconditions.checkArgument(!name.isEmpty(), "Empty name");
        checkNotClosed();
        if (!this.names.add(name)) {
            throw new BusException(BusException.ADDRESS_IN_USE, "Name " + name
                    + " already owned");
        }
    }

    @Override
    public synchronized void releaseName(final String name) throws BusException {
        checkNotClosed();
        this.names.remove(name);
    }

    @Override
    public synchronized Registration exportObject(final ObjectPath path,
            final String interfaceName, final MethodHandler handler) throws BusException {
        Preconditions.checkNotNull(handler);
        checkNotClosed();
        Map<String, MethodHandler> interfaces = this.objects.get(path);
        if (interfaces == null) {
            interfaces = Maps.newHashMap();
            this.objects.put(path, interfaces);
        }
        if (interfaces.containsKey(interfaceName)) {
            throw new BusException(BusException.ADDRESS_IN_USE, "Interface " + interfaceName
                    + " already exported at " + path);
        }
        interfaces.put(interfaceName, handler);
        return new LocalRegistration(path, interfaceName, handler);
    }

    private synchronized void unexportObject(final ObjectPath path, final String interfaceName,
            final MethodHandler handler) {
        final Map<String, MethodHandler> interfaces = this.objects.get(path);
        if (interfaces != null && interfaces.get(interfaceName) == handler) {
            interfaces.remove(interfaceName);
            if (interfaces.isEmpty()) {
                this.objects.remove(path);
            }
        }
    }

    private synchronized MethodHandler lookup(final MethodCall call) throws BusException {
        checkNotClosed();
        final String destination = call.getDestination();
        if (destination != null && !this.names.contains(destination)) {
            throw new BusException(BusException.SERVICE_UNKNOWN, "The name " + destination
                    + " was not provided by any service");
        }
        final Map<String, MethodHandler> interfaces = this.objects.get(call.getPath());
        if (interfaces == null) {
            throw new BusException(BusException.UNKNOWN_OBJECT, "No such object path "
                    + call.getPath());
        }
        final MethodHandler handler = interfaces.get(call.getInterfaceName());
        if (handler == null) {
            throw new BusException(BusException.UNKNOWN_INTERFACE, "No such interface "
                    + call.getInterfaceName() + " at object path " + call.getPath());
        }
        return handler;
    }

    @Nullable
    @Override
    public Object call(final MethodCall call) throws BusException {

        final MethodHandler handler = lookup(call);
        final ListenableFuture<Object> future;
        try {
            future = this.dispatcher.submit(new Callable<Object>() {

                @Override
                public Object call() throws Exception {
                    return handler.handle(call);
                }

            });
        } catch (final RejectedExecutionException ex) {
            throw new BusException(BusException.NO_SERVER, this.id + " is closing", ex);
        }

        final Object result;
        try {
            result = future.get(this.callTimeout, TimeUnit.MILLISECONDS);
        } catch (final TimeoutException ex) {
            future.cancel(true);
            throw new BusException(BusException.NO_REPLY, "No reply to " + call.getMember()
                    + " within " + this.callTimeout + " ms", ex);
        } catch (final ExecutionException ex) {
            throw BusException.forFailure(ex.getCause());
        } catch (final InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BusException(BusException.FAILED, "Interrupted while waiting reply", ex);
        }

        if (result != null) {
            try {
                Message.checkArgument(result);
            } catch (final IllegalArgumentException ex) {
                throw new BusException(BusException.FAILED, "Invalid reply to "
                        + call.getMember() + ": " + ex.getMessage(), ex);
            }
        }
        return result;
    }

    @Override
    public void emitSignal(final Signal signal) throws BusException {
        checkNotClosed();
        for (final LocalSubscription subscription : this.subscriptions) {
            if (subscription.getMatch().matches(signal)) {
                try {
                    this.delivery.execute(new Runnable() {

                        @Override
                        public void run() {
                            subscription.deliver(signal);
                        }

                    });
                } catch (final RejectedExecutionException ex) {
                    throw new BusException(BusException.NO_SERVER, this.id + " is closing", ex);
                }
            }
        }
    }

    @Override
    public Subscription subscribe(final SignalMatch match, final SignalHandler handler)
            throws BusException {
        Preconditions.checkNotNull(match);
        Preconditions.checkNotNull(handler);
        checkNotClosed();
        final LocalSubscription subscription = new LocalSubscription(match, handler);
        this.subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public void close() {
        if (!this.closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            this.names.clear();
            this.objects.clear();
        }
        for (final LocalSubscription subscription : this.subscriptions) {
            subscription.cancel();
        }
        MoreExecutors.shutdownAndAwaitTermination(this.delivery, 5, TimeUnit.SECONDS);
        MoreExecutors.shutdownAndAwaitTermination(this.dispatcher, 5, TimeUnit.SECONDS);
        LOGGER.debug("{} closed", this);
    }

    @Override
    public String toString() {
        return this.id;
    }

    private final class LocalRegistration implements Registration {

        private final ObjectPath path;

        private final String interfaceName;

        private final MethodHandler handler;

        LocalRegistration(final ObjectPath path, final String interfaceName,
                final MethodHandler handler) {
            this.path = path;
            this.interfaceName = interfaceName;
            this.handler = handler;
        }

        @Override
        public ObjectPath getPath() {
            return this.path;
        }

        @Override
        public String getInterfaceName() {
            return this.interfaceName;
        }

        @Override
        public void unregister() {
            unexportObject(this.path, this.interfaceName, this.handler);
        }

    }

    private final class LocalSubscription implements Subscription {

        private final SignalMatch match;

        private final SignalHandler handler;

        private volatile boolean cancelled;

        LocalSubscription(final SignalMatch match, final SignalHandler handler) {
            this.match = match;
            this.handler = handler;
            this.cancelled = false;
        }

        @Override
        public SignalMatch getMatch() {
            return this.match;
        }

        @Override
        public boolean isCancelled() {
            return this.cancelled;
        }

        @Override
        public void cancel() {
            this.cancelled = true;
            LocalBus.this.subscriptions.remove(this);
        }

        void deliver(final Signal signal) {
            if (this.cancelled) {
                return;
            }
            try {
                this.handler.handle(signal);
            } catch (final Throwable ex) {
                LOGGER.error("Signal handler failed on " + signal, ex);
            }
        }

    }

}
