package eu.fbk.confman.server.http.jaxrs;

import java.io.Closeable;
import java.util.Set;
import java.util.function.BiConsumer;

import javax.annotation.Nullable;
import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.sse.OutboundSseEvent;
import javax.ws.rs.sse.Sse;
import javax.ws.rs.sse.SseEventSink;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.bus.Bus;
import eu.fbk.confman.bus.BusException;
import eu.fbk.confman.bus.ObjectPath;
import eu.fbk.confman.bus.Signal;
import eu.fbk.confman.bus.SignalHandler;
import eu.fbk.confman.bus.SignalMatch;
import eu.fbk.confman.bus.Subscription;
import eu.fbk.confman.internal.Util;
import eu.fbk.confman.internal.jaxrs.Protocol;

/**
 * Streams the signals emitted on the bus to remote subscribers as server-sent events.
 * <p>
 * Each request opens a bus subscription that lives as long as the event stream. The
 * {@value Protocol#EVENT_SUBSCRIBED} event is sent once the subscription is in place and before
 * any signal, so that a client receiving it knows no later signal will be missed.
 * </p>
 */
@Path("/" + Protocol.PATH_SIGNALS)
public final class Signals implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Signals.class);

    private final Bus bus;

    private final Set<Stream> streams;

    public Signals(final Bus bus) {
        this.bus = Preconditions.checkNotNull(bus);
        this.streams = Sets.newConcurrentHashSet();
    }

    @GET
    @Produces(MediaType.SERVER_SENT_EVENTS)
    public void subscribe(@QueryParam(Protocol.PARAM_PATH) @Nullable final String path,
            @QueryParam(Protocol.PARAM_INTERFACE) @Nullable final String interfaceName,
            @QueryParam(Protocol.PARAM_MEMBER) @Nullable final String member,
            @Context final SseEventSink sink, @Context final Sse sse) {

        final SignalMatch match;
        try {
            match = new SignalMatch(path == null ? null : ObjectPath.valueOf(path),
                    interfaceName, member);
        } catch (final IllegalArgumentException ex) {
            throw fail(new BusException(BusException.INVALID_ARGS, ex.getMessage(), ex));
        }

        final Stream stream = new Stream(sink, sse);
        synchronized (stream) {
            try {
                stream.open(this.bus.subscribe(match, stream));
            } catch (final BusException ex) {
                throw fail(ex);
            }
        }
        LOGGER.debug("Signal stream opened for {}", match);
    }

    /**
     * Cancels all the open subscriptions and closes their event streams.
     */
    @Override
    public void close() {
        for (final Stream stream : ImmutableList.copyOf(this.streams)) {
            stream.close();
        }
    }

    private static WebApplicationException fail(final BusException ex) {
        return new WebApplicationException(ex, Response.status(Protocol.statusFor(
                ex.getErrorName())).entity(Protocol.encodeError(ex)).type(
                MediaType.APPLICATION_JSON_TYPE).build());
    }

    private final class Stream implements SignalHandler {

        private final SseEventSink sink;

        private final Sse sse;

        @Nullable
        private Subscription subscription;

        Stream(final SseEventSink sink, final Sse sse) {
            this.sink = sink;
            this.sse = sse;
            this.subscription = null;
        }

        synchronized void open(final Subscription subscription) {
            this.subscription = subscription;
            Signals.this.streams.add(this);
            send(this.sse.newEvent(Protocol.EVENT_SUBSCRIBED, ""));
        }

        @Override
        public synchronized void handle(final Signal signal) {
            if (this.subscription != null && !this.subscription.isCancelled()) {
                send(this.sse.newEventBuilder().name(signal.getMember())
                        .data(String.class, Protocol.encodeSignal(signal)).build());
            }
        }

        synchronized void close() {
            if (this.subscription != null && !this.subscription.isCancelled()) {
                this.subscription.cancel();
                LOGGER.debug("Signal stream closed for {}", this.subscription.getMatch());
            }
            Signals.this.streams.remove(this);
            Util.closeQuietly(this.sink);
        }

        private void send(final OutboundSseEvent event) {
            if (this.sink.isClosed()) {
                close();
                return;
            }
            try {
                this.sink.send(event).whenComplete(new BiConsumer<Object, Throwable>() {

                    @Override
                    public void accept(final Object result, final Throwable ex) {
                        if (ex != null) {
                            LOGGER.debug("Event delivery failed: {}", ex.getMessage());
                            close();
                        }
                    }

                });
            } catch (final IllegalStateException ex) {
                close();
            }
        }

    }

}
