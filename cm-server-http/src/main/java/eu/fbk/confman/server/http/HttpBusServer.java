package eu.fbk.confman.server.http;

import java.io.IOException;
import java.net.URI;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.StatisticsHandler;
import org.glassfish.jersey.jetty.JettyHttpContainer;
import org.glassfish.jersey.server.ContainerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.bus.Bus;
import eu.fbk.confman.runtime.Component;
import eu.fbk.confman.server.http.jaxrs.Application;

/**
 * Publishes a {@code Bus} over HTTP, so that processes other than the one owning the bus can
 * call exported objects and receive signals.
 * <p>
 * The server is built with Jetty and Jersey and is started by {@link #init()}. Binding the
 * listening port acts as the claim of the service name for the host: a second server on the same
 * host and port fails to start. Port 0 selects a free port, which is then returned by
 * {@link #getPort()}.
 * </p>
 */
public final class HttpBusServer implements Component {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpBusServer.class);

    public static final String DEFAULT_HOST = "127.0.0.1";

    public static final int DEFAULT_PORT = 8765;

    private static final int ACCEPTORS = -1; // -1 = platform specific

    private static final int SELECTORS = -1; // -1 = platform specific

    private static final long IDLE_TIMEOUT = 0; // signal streams stay open while idle

    private static final long STOP_TIMEOUT = 1000; // wait 1 s before forcing closure

    private final String host;

    private final int port;

    private final Application application;

    private final Server server;

    private final ServerConnector connector;

    private boolean initialized;

    private boolean closed;

    public HttpBusServer(final Bus bus, @Nullable final String host, @Nullable final Integer port) {
        this.host = MoreObjects.firstNonNull(host, DEFAULT_HOST);
        this.port = MoreObjects.firstNonNull(port, DEFAULT_PORT);
        Preconditions.checkArgument(this.port >= 0 && this.port < 65536, "Invalid port %s",
                this.port);

        this.application = new Application(bus);

        final HttpConfiguration config = new HttpConfiguration();
        config.setSendServerVersion(false);
        config.setSendDateHeader(true);

        this.server = new Server();
        this.server.setStopAtShutdown(false);
        this.connector = new ServerConnector(this.server, ACCEPTORS, SELECTORS,
                new HttpConnectionFactory(config));
        this.connector.setHost(this.host);
        this.connector.setPort(this.port);
        this.connector.setIdleTimeout(IDLE_TIMEOUT);
        this.server.addConnector(this.connector);

        final StatisticsHandler statHandler = new StatisticsHandler();
        statHandler.setHandler(ContainerFactory.createContainer(JettyHttpContainer.class,
                this.application));
        this.server.setHandler(statHandler);

        this.initialized = false;
        this.closed = false;
    }

    @Override
    public synchronized void init() throws IOException {
        Preconditions.checkState(!this.initialized && !this.closed);
        this.initialized = true;
        try {
            this.server.start();
            LOGGER.info("Jetty {} started, listening on {}", Server.getVersion(), getURI());
        } catch (final Exception ex) {
            try {
                this.server.stop();
            } catch (final Exception ex2) {
                ex.addSuppressed(ex2);
            }
            throw new IOException("Cannot listen on " + this.host + ":" + this.port + ": "
                    + ex.getMessage(), ex);
        }
    }

    /**
     * Returns the port the server is listening on, which differs from the configured one only
     * when the latter is 0.
     *
     * @return the local port, or -1 if the server is not listening
     */
    public int getPort() {
        return this.connector.getLocalPort();
    }

    public URI getURI() {
        return URI.create("http://" + this.host + ":" + getPort() + "/");
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        this.application.close();
        try {
            this.server.setStopTimeout(STOP_TIMEOUT);
            this.server.stop();
            LOGGER.info("Jetty {} stopped", Server.getVersion());
        } catch (final Exception ex) {
            // Jetty already logs the details
            LOGGER.warn("Jetty {} stopped (with errors)", Server.getVersion());
        }
    }

    @Override
    public String toString() {
        return "HttpBusServer[" + this.host + ":" + this.port + "]";
    }

}
