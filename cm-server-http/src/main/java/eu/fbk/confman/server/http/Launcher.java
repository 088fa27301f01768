package eu.fbk.confman.server.http;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.Nullable;

import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.LoggerContext;

import eu.fbk.confman.Names;
import eu.fbk.confman.bus.Bus;
import eu.fbk.confman.bus.LocalBus;
import eu.fbk.confman.bus.LoggingBus;
import eu.fbk.confman.internal.CommandLine;
import eu.fbk.confman.internal.Logging;
import eu.fbk.confman.server.Broker;

/**
 * Command line entry point of the configuration broker.
 * <p>
 * The launcher scans the configuration directory, publishes the discovered applications on an
 * in-process bus and exposes that bus over HTTP. It then runs until {@code q} is entered on
 * standard input or the JVM is asked to terminate (e.g., SIGINT). The program name and
 * description shown in the help can be customized with the {@code launcher.executable} and
 * {@code launcher.description} system properties. The exit status is 0 on normal termination,
 * 1 on syntax errors and startup failures.
 * </p>
 */
public final class Launcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(Launcher.class);

    private static final String PROGRAM_EXECUTABLE = retrieveProperty("launcher.executable",
            "cm-server");

    private static final String PROGRAM_DESCRIPTION = retrieveProperty("launcher.description",
            "Publishes the configurations of a directory of JSON files, one per application, "
                    + "and notifies clients of every change.");

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
                    .withName(PROGRAM_EXECUTABLE)
                    .withHeader(PROGRAM_DESCRIPTION)
                    .withFooter("Once started, enter q or send SIGINT to stop the broker.")
                    .withOption("d", "config-dir",
                            "the directory with the configuration files (default: "
                                    + Names.DEFAULT_CONFIG_DIR + ")", "DIR",
                            CommandLine.Type.DIRECTORY, false)
                    .withOption("r", "recursive", "scan also the subdirectories of the "
                            + "configuration directory")
                    .withOption(null, "host", "the host the HTTP gateway listens on (default: "
                            + HttpBusServer.DEFAULT_HOST + ")", "HOST",
                            CommandLine.Type.STRING, false)
                    .withOption("p", "port", "the port the HTTP gateway listens on (default: "
                            + HttpBusServer.DEFAULT_PORT + ")", "PORT", CommandLine.Type.PORT,
                            false)
                    .withOption(null, "service-name", "the service name to claim (default: "
                            + Names.DEFAULT_SERVICE_NAME + ")", "NAME",
                            CommandLine.Type.STRING, false)
                    .withLogger(LoggerFactory.getLogger("eu.fbk.confman")).parse(args);

            final Path configDir = cmd.getOptionValue("config-dir", Path.class,
                    Names.expandHome(Names.DEFAULT_CONFIG_DIR));
            final boolean recursive = cmd.hasOption("recursive");
            final String host = cmd.getOptionValue("host", String.class,
                    HttpBusServer.DEFAULT_HOST);
            final int port = cmd.getOptionValue("port", Integer.class,
                    HttpBusServer.DEFAULT_PORT);
            final String serviceName = cmd.getOptionValue("service-name", String.class,
                    Names.DEFAULT_SERVICE_NAME);

            Logging.installBridge();
            run(configDir, recursive, host, port, serviceName);

        } catch (final Throwable ex) {
            status = CommandLine.report(ex, System.err);
            if (!(ex instanceof CommandLine.Exception)) {
                LOGGER.error("Broker terminated", ex);
            }
        }

        // Flush STDOUT and STDERR before exiting
        System.out.flush();
        System.err.flush();

        // Force exiting (in case there are threads still running)
        System.exit(status);
    }

    private static void run(final Path configDir, final boolean recursive, final String host,
            final int port, final String serviceName) throws Exception {

        final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
        final Thread mainThread = Thread.currentThread();
        final Lock lock = new ReentrantLock();

        // Define shutdown handler, which delegates the shutdown to the main thread and waits
        final Thread shutdownHandler = new Thread("shutdown") {

            @Override
            public void run() {
                shutdownRequested.set(true);
                mainThread.interrupt();
                lock.lock();
                lock.unlock();
            }

        };

        final Bus bus = new LoggingBus(new LocalBus());
        final Broker broker = new Broker(bus, configDir, recursive, serviceName);
        final HttpBusServer server = new HttpBusServer(bus, host, port);

        lock.lock();
        try {
            broker.init();
            server.init();
            Runtime.getRuntime().addShutdownHook(shutdownHandler);
            LOGGER.info("Serving {} applications at {}; issue q\\n/SIGINT to end",
                    broker.getApplicationNames().size(), server.getURI());

            // Check terminal input until a shutdown is requested or the broker stops
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
                    if (broker.awaitTermination(1, TimeUnit.SECONDS)) {
                        break;
                    }
                } catch (final InterruptedException ex) {
                    LOGGER.debug("Interrupted, shutdown requested: {}", shutdownRequested.get());
                }
            }

        } finally {
            try {
                server.close();
                broker.close();
                bus.close();

            } finally {
                try {
                    Runtime.getRuntime().removeShutdownHook(shutdownHandler);
                } catch (final IllegalStateException ex) {
                    LOGGER.debug("Shutdown in progress, hook not removed");
                }

                // Stop logging, flushing pending output
                final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
                if (factory instanceof LoggerContext) {
                    ((LoggerContext) factory).stop();
                }

                lock.unlock();
            }
        }
    }

    @Nullable
    private static String retrieveProperty(final String property,
            @Nullable final String defaultValue) {
        final String value = System.getProperty(property);
        return value != null && !value.trim().isEmpty() ? value.trim() : defaultValue;
    }

    private Launcher() {
    }

}
