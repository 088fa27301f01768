package eu.fbk.confman.client;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import javax.annotation.Nullable;
import javax.ws.rs.ProcessingException;
import javax.ws.rs.client.ClientBuilder;
import javax.ws.rs.client.Entity;
import javax.ws.rs.client.WebTarget;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.sse.InboundSseEvent;
import javax.ws.rs.sse.SseEventSource;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;

import org.glassfish.jersey.client.ClientConfig;
import org.glassfish.jersey.client.ClientProperties;
import org.glassfish.jersey.media.sse.SseFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.bus.Bus;
import eu.fbk.confman.bus.BusException;
import eu.fbk.confman.bus.LocalBus;
import eu.fbk.confman.bus.MethodCall;
import eu.fbk.confman.bus.MethodHandler;
import eu.fbk.confman.bus.ObjectPath;
import eu.fbk.confman.bus.Registration;
import eu.fbk.confman.bus.Signal;
import eu.fbk.confman.bus.SignalHandler;
import eu.fbk.confman.bus.SignalMatch;
import eu.fbk.confman.bus.Subscription;
import eu.fbk.confman.internal.Util;
import eu.fbk.confman.internal.jaxrs.Protocol;

/**
 * A client-side {@code Bus} reaching a bus published over HTTP by a remote gateway.
 * <p>
 * Method calls are POSTed to the gateway; subscriptions are realized as streams of server-sent
 * events, one per subscription, whose events are delivered in order on the thread of the stream.
 * This bus can only act as a client: requesting names, exporting objects and emitting signals
 * fail with {@link BusException#NOT_SUPPORTED}. Failing to reach the gateway is reported as
 * {@link BusException#NO_SERVER}.
 * </p>
 */
public final class HttpBus implements Bus {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpBus.class);

    private static final String USER_AGENT = String.format("ConfigurationManager/%s",
            Util.getVersion("eu.fbk.confman", "cm-client", "devel"));

    public static final int DEFAULT_CONNECTION_TIMEOUT = 5000;

    private static final long CALL_GRACE_PERIOD = 5000; // extra time beyond the bus call timeout

    private static final long RECONNECT_DELAY = 1000;

    private final String serverURL;

    private final int connectionTimeout;

    private final javax.ws.rs.client.Client client;

    private final List<RemoteSubscription> subscriptions;

    private final AtomicBoolean closed;

    public HttpBus(final String serverURL) {
        this(serverURL, null);
    }

    public HttpBus(final String serverURL, @Nullable final Integer connectionTimeout) {

        String url = Preconditions.checkNotNull(serverURL);
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }

        final int timeout = MoreObjects.firstNonNull(connectionTimeout,
                DEFAULT_CONNECTION_TIMEOUT);
        Preconditions.checkArgument(timeout > 0, "Invalid connection timeout %s", timeout);

        this.serverURL = url;
        this.connectionTimeout = timeout;
        this.client = createJaxrsClient(timeout);
        this.subscriptions = new CopyOnWriteArrayList<RemoteSubscription>();
        this.closed = new AtomicBoolean(false);
    }

    private static javax.ws.rs.client.Client createJaxrsClient(final int connectionTimeout) {
        final ClientConfig config = new ClientConfig();
        config.property(ClientProperties.CONNECT_TIMEOUT, connectionTimeout);
        config.property(ClientProperties.FOLLOW_REDIRECTS, false);
        config.register(SseFeature.class);
        return ClientBuilder.newClient(config);
    }

    public String getServerURL() {
        return this.serverURL;
    }

    @Override
    public void requestName(final String name) throws BusException {
        throw unsupported("requestName");
    }

    @Override
    public void releaseName(final String name) throws BusException {
        throw unsupported("releaseName");
    }

    @Override
    public Registration exportObject(final ObjectPath path, final String interfaceName,
            final MethodHandler handler) throws BusException {
        throw unsupported("exportObject");
    }

    @Override
    public void emitSignal(final Signal signal) throws BusException {
        throw unsupported("emitSignal");
    }

    @Nullable
    @Override
    public Object call(final MethodCall call) throws BusException {
        checkNotClosed();
        final String body = Protocol.encodeCall(call);
        final Response response;
        try {
            response = this.client.target(this.serverURL).path(Protocol.PATH_CALL)
                    .request(MediaType.APPLICATION_JSON_TYPE)
                    .header(HttpHeaders.USER_AGENT, USER_AGENT)
                    .property(ClientProperties.READ_TIMEOUT,
                            (int) (LocalBus.DEFAULT_CALL_TIMEOUT + CALL_GRACE_PERIOD))
                    .post(Entity.json(body));
        } catch (final ProcessingException ex) {
            throw failure(ex);
        }
        try {
            final int status = response.getStatus();
            final String entity = response.readEntity(String.class);
            LOGGER.debug("Http: {} for {}", status, call);
            if (status == 200) {
                return Protocol.decodeReply(entity);
            }
            throw Protocol.decodeError(status, entity);
        } catch (final ProcessingException ex) {
            throw failure(ex);
        } finally {
            response.close();
        }
    }

    /**
     * {@inheritDoc} This method returns only after the gateway has confirmed the subscription.
     */
    @Override
    public Subscription subscribe(final SignalMatch match, final SignalHandler handler)
            throws BusException {

        checkNotClosed();
        Preconditions.checkNotNull(handler);

        WebTarget target = this.client.target(this.serverURL).path(Protocol.PATH_SIGNALS);
        if (match.getPath() != null) {
            target = target.queryParam(Protocol.PARAM_PATH, match.getPath().toString());
        }
        if (match.getInterfaceName() != null) {
            target = target.queryParam(Protocol.PARAM_INTERFACE, match.getInterfaceName());
        }
        if (match.getMember() != null) {
            target = target.queryParam(Protocol.PARAM_MEMBER, match.getMember());
        }

        final SseEventSource source = SseEventSource.target(target)
                .reconnectingEvery(RECONNECT_DELAY, TimeUnit.MILLISECONDS).build();
        final RemoteSubscription subscription = new RemoteSubscription(match, source);
        final CountDownLatch handshake = new CountDownLatch(1);
        final AtomicReference<Throwable> error = new AtomicReference<Throwable>();

        source.register(new Consumer<InboundSseEvent>() {

            @Override
            public void accept(final InboundSseEvent event) {
                if (Protocol.EVENT_SUBSCRIBED.equals(event.getName())) {
                    if (handshake.getCount() == 0) {
                        LOGGER.warn("Signal stream for {} re-established, signals may have "
                                + "been lost", match);
                    }
                    handshake.countDown();
                } else if (event.getName() != null && !subscription.isCancelled()) {
                    deliver(subscription, handler, event);
                }
            }

        }, new Consumer<Throwable>() {

            @Override
            public void accept(final Throwable ex) {
                if (handshake.getCount() > 0) {
                    error.set(ex);
                    handshake.countDown();
                } else if (!subscription.isCancelled()) {
                    LOGGER.warn("Signal stream for {} failed: {}", match, ex.toString());
                }
            }

        });

        source.open();
        boolean subscribed = false;
        try {
            if (!handshake.await(this.connectionTimeout, TimeUnit.MILLISECONDS)) {
                throw new BusException(BusException.NO_SERVER, "No subscription confirmed by "
                        + this.serverURL + " within " + this.connectionTimeout + " ms");
            } else if (error.get() != null) {
                throw failure(error.get());
            }
            this.subscriptions.add(subscription);
            subscribed = true;
            LOGGER.debug("Subscribed to {} at {}", match, this.serverURL);
            return subscription;

        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BusException(BusException.FAILED, "Interrupted while subscribing", ex);

        } finally {
            if (!subscribed) {
                subscription.cancel();
            }
        }
    }

    @Override
    public void close() {
        if (!this.closed.compareAndSet(false, true)) {
            return;
        }
        try {
            for (final RemoteSubscription subscription : ImmutableList
                    .copyOf(this.subscriptions)) {
                subscription.cancel();
            }
        } finally {
            this.client.close();
        }
        LOGGER.debug("{} closed", this);
    }

    @Override
    public String toString() {
        return "HttpBus[" + this.serverURL + "]";
    }

    private void deliver(final RemoteSubscription subscription, final SignalHandler handler,
            final InboundSseEvent event) {
        final Signal signal;
        try {
            signal = Protocol.decodeSignal(event.readData(String.class));
        } catch (final BusException | RuntimeException ex) {
            LOGGER.warn("Ignoring malformed signal event '{}': {}", event.getName(),
                    ex.getMessage());
            return;
        }
        if (subscription.getMatch().matches(signal)) {
            try {
                handler.handle(signal);
            } catch (final Throwable ex) {
                LOGGER.error("Signal handler failed for " + signal, ex);
            }
        }
    }

    private void checkNotClosed() {
        Preconditions.checkState(!this.closed.get(), "%s closed", this);
    }

    private BusException failure(final Throwable ex) {
        if (Throwables.getRootCause(ex) instanceof SocketTimeoutException) {
            return new BusException(BusException.NO_REPLY, "No reply from " + this.serverURL,
                    ex);
        }
        return new BusException(BusException.NO_SERVER, "Cannot reach " + this.serverURL + ": "
                + ex.getMessage(), ex);
    }

    private BusException unsupported(final String operation) {
        return new BusException(BusException.NOT_SUPPORTED, operation
                + " not supported by a remote bus client");
    }

    private final class RemoteSubscription implements Subscription {

        private final SignalMatch match;

        private final SseEventSource source;

        private final AtomicBoolean cancelled;

        RemoteSubscription(final SignalMatch match, final SseEventSource source) {
            this.match = match;
            this.source = source;
            this.cancelled = new AtomicBoolean(false);
        }

        @Override
        public SignalMatch getMatch() {
            return this.match;
        }

        @Override
        public boolean isCancelled() {
            return this.cancelled.get();
        }

        @Override
        public void cancel() {
            if (this.cancelled.compareAndSet(false, true)) {
                HttpBus.this.subscriptions.remove(this);
                this.source.close(1, TimeUnit.SECONDS);
            }
        }

    }

}
