package eu.fbk.confman.client;

import java.io.Closeable;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.Names;
import eu.fbk.confman.bus.Bus;
import eu.fbk.confman.bus.Subscription;
import eu.fbk.confman.internal.CommandLine;
import eu.fbk.confman.internal.Logging;

/**
 * A client of the configuration manager, printing a phrase at a configurable interval.
 * <p>
 * At startup the client loads its settings from a local file, creating it from defaults when
 * missing, subscribes to the changes of its configuration published by the broker and starts a
 * {@link TimeoutWorker}. The application name is the base name of the local file. Changes
 * notified by the broker are applied to the {@link ClientCache} as they arrive.
 * </p>
 */
public final class ClientApplication implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientApplication.class);

    public static final String DEFAULT_APPLICATION_NAME = "confManagerApplication1";

    public static final String DEFAULT_CONFIG_PATH = Names.DEFAULT_CONFIG_DIR + "/"
            + DEFAULT_APPLICATION_NAME + Names.CONFIG_FILE_EXTENSION;

    public static final String DEFAULT_SERVER_URL = "http://127.0.0.1:8765/";

    private final Path configPath;

    private final ConfigurationProxy proxy;

    private final ClientCache cache;

    private final TimeoutWorker worker;

    @Nullable
    private Subscription subscription;

    public ClientApplication(final Bus bus, final String serviceName, final Path configPath,
            final ClientCache cache, final PrintStream out) {
        this.configPath = Preconditions.checkNotNull(configPath);
        this.proxy = new ConfigurationProxy(bus, serviceName, Names.applicationName(configPath));
        this.cache = Preconditions.checkNotNull(cache);
        this.worker = new TimeoutWorker(cache, out);
        this.subscription = null;
    }

    public ConfigurationProxy getProxy() {
        return this.proxy;
    }

    public ClientCache getCache() {
        return this.cache;
    }

    /**
     * Starts the client.
     *
     * @param forceCreate
     *            true to overwrite the local configuration file with the current settings
     * @throws ConfigurationException
     *             if the local file cannot be loaded or created, or the broker cannot be reached
     */
    public synchronized void start(final boolean forceCreate) throws ConfigurationException {
        Preconditions.checkState(this.subscription == null, "Client already started");
        this.cache.initialize(this.configPath, forceCreate);
        this.subscription = this.proxy.subscribe(this.cache);
        this.worker.start();
        LOGGER.info("Client for {} started", this.proxy.getApplicationName());
    }

    /**
     * Stops the worker, waiting for its termination, and cancels the subscription.
     */
    @Override
    public synchronized void close() {
        this.worker.stop();
        if (this.subscription != null) {
            this.subscription.cancel();
        }
    }

    /**
     * Program entry point.
     *
     * @param args
     *            command line arguments
     */
    public static void main(final String... args) {

        int status = CommandLine.EXIT_SUCCESS;

        try {
            final CommandLine cmd = CommandLine
                    .parser()
                    .withName("cm-client")
                    .withHeader("Prints a phrase periodically, adopting the timeout and phrase "
                            + "published by the configuration manager.")
                    .withOption("t", "timeout", "the default timeout in milliseconds (default: "
                            + ClientCache.DEFAULT_TIMEOUT + ")", "MS",
                            CommandLine.Type.POSITIVE_INTEGER, false)
                    .withOption("p", "phrase", "the default phrase (default: "
                            + ClientCache.DEFAULT_PHRASE + ")", "TEXT", CommandLine.Type.STRING,
                            false)
                    .withOption("c", "config-path", "the local configuration file (default: "
                            + DEFAULT_CONFIG_PATH + ")", "FILE", CommandLine.Type.FILE, false)
                    .withOption("f", "create-config", "overwrite the local configuration file "
                            + "with the defaults")
                    .withOption("s", "server", "the URL of the configuration manager (default: "
                            + DEFAULT_SERVER_URL + ")", "URL", CommandLine.Type.URI, false)
                    .withOption(null, "service-name", "the service name of the configuration "
                            + "manager (default: " + Names.DEFAULT_SERVICE_NAME + ")", "NAME",
                            CommandLine.Type.STRING, false)
                    .withLogger(LoggerFactory.getLogger("eu.fbk.confman")).parse(args);

            final long timeout = cmd.getOptionValue("timeout", Long.class,
                    ClientCache.DEFAULT_TIMEOUT);
            final String phrase = cmd.getOptionValue("phrase", String.class,
                    ClientCache.DEFAULT_PHRASE);
            final Path configPath = cmd.getOptionValue("config-path", Path.class,
                    Names.expandHome(DEFAULT_CONFIG_PATH));
            final boolean forceCreate = cmd.hasOption("create-config");
            final URI server = cmd.getOptionValue("server", URI.class,
                    URI.create(DEFAULT_SERVER_URL));
            final String serviceName = cmd.getOptionValue("service-name", String.class,
                    Names.DEFAULT_SERVICE_NAME);

            Logging.installBridge();
            final HttpBus bus = new HttpBus(server.toString());
            try {
                final ClientApplication client = new ClientApplication(bus, serviceName,
                        configPath, new ClientCache(timeout, phrase), System.out);
                run(client, forceCreate);
            } finally {
                bus.close();
            }

        } catch (final Throwable ex) {
            status = CommandLine.report(ex, System.err);
            if (!(ex instanceof CommandLine.Exception)) {
                LOGGER.error("Client terminated: {}", ex.toString());
            }
        }

        System.out.flush();
        System.err.flush();
        System.exit(status);
    }

    private static void run(final ClientApplication client, final boolean forceCreate)
            throws ConfigurationException {

        final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
        final Thread mainThread = Thread.currentThread();
        final Lock lock = new ReentrantLock();

        final Thread shutdownHandler = new Thread("shutdown") {

            @Override
            public void run() {
                shutdownRequested.set(true);
                mainThread.interrupt();
                lock.lock();
                lock.unlock();
            }

        };

        lock.lock();
        try {
            client.start(forceCreate);
            Runtime.getRuntime().addShutdownHook(shutdownHandler);
            LOGGER.info("Issue q\\n/SIGINT to end");

            while (!shutdownRequested.get()) {
                try {
                    while (!shutdownRequested.get() && System.in.available() > 0) {
                        final char ch = (char) System.in.read();
                        if (ch == 'q' || ch == 'Q') {
                            shutdownRequested.set(true);
                        }
                    }
                } catch (final IOException ex) {
                    LOGGER.debug("Cannot read standard input: {}", ex.getMessage());
                }
                try {
                    if (!shutdownRequested.get()) {
                        Thread.sleep(500);
                    }
                } catch (final InterruptedException ex) {
                    LOGGER.debug("Interrupted, shutdown requested: {}", shutdownRequested.get());
                }
            }

        } finally {
            try {
                client.close();
            } finally {
                try {
                    Runtime.getRuntime().removeShutdownHook(shutdownHandler);
                } catch (final IllegalStateException ex) {
                    LOGGER.debug("Shutdown in progress, hook not removed");
                }
                lock.unlock();
            }
        }
    }

}
