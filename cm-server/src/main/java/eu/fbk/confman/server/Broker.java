package eu.fbk.confman.server;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.bus.Bus;
import eu.fbk.confman.bus.BusException;
import eu.fbk.confman.runtime.Component;

/**
 * The configuration broker: publishes on a bus the configuration of every application found in
 * a configuration directory.
 * <p>
 * A broker goes through the states of {@link State}. Method {@link #init()} scans the directory,
 * claims the service name and exports one {@link ApplicationEndpoint} per application; startup
 * is all-or-nothing, so that on any failure whatever was registered is withdrawn before the
 * exception is thrown. Once running, calls are dispatched by the bus; {@link #run()} blocks the
 * owner of the process main loop until {@link #close()} is called. Applications are fixed at
 * startup: the directory is not scanned again.
 * </p>
 * <p>
 * Brokers are ordinary objects: several instances may coexist in a process provided that they
 * use different buses or service names.
 * </p>
 */
public final class Broker implements Component {

    private static final Logger LOGGER = LoggerFactory.getLogger(Broker.class);

    private final Bus bus;

    private final Path configDir;

    private final boolean recursive;

    private final String serviceName;

    private final Map<String, ApplicationEndpoint> endpoints;

    private final CountDownLatch terminated;

    private volatile State state;

    private boolean nameAcquired;

    /**
     * Creates a new broker. No activity is carried out until {@link #init()} is called.
     *
     * @param bus
     *            the bus where to publish configurations; not closed by the broker
     * @param configDir
     *            the configuration directory
     * @param recursive
     *            true to also scan the subdirectories of the configuration directory
     * @param serviceName
     *            the service name to claim on the bus
     */
    public Broker(final Bus bus, final Path configDir, final boolean recursive,
            final String serviceName) {
        Preconditions.checkArgument(!serviceName.isEmpty(), "Empty service name");
        this.bus = Preconditions.checkNotNull(bus);
        this.configDir = Preconditions.checkNotNull(configDir);
        this.recursive = recursive;
        this.serviceName = serviceName;
        this.endpoints = Maps.newLinkedHashMap();
        this.terminated = new CountDownLatch(1);
        this.state = State.UNINITIALIZED;
        this.nameAcquired = false;
    }

    public State getState() {
        return this.state;
    }

    public String getServiceName() {
        return this.serviceName;
    }

    @Override
    public synchronized void init() throws IOException, ConfigurationException {

        Preconditions.checkState(this.state == State.UNINITIALIZED, "Broker already %s",
                this.state == State.STOPPED ? "closed" : "initialized");

        try {
            this.state = State.SCANNING_CONFIG_DIR;
            final Map<String, Path> files = ConfigDirectory.scan(this.configDir, this.recursive);

            this.state = State.REGISTERING;
            this.bus.requestName(this.serviceName);
            this.nameAcquired = true;
            for (final Map.Entry<String, Path> entry : files.entrySet()) {
                final ApplicationEndpoint endpoint = new ApplicationEndpoint(this.bus,
                        this.serviceName, entry.getKey(), entry.getValue());
                endpoint.export();
                this.endpoints.put(entry.getKey(), endpoint);
                LOGGER.info("Application {} registered from {}", entry.getKey(),
                        entry.getValue());
            }

            this.state = State.RUNNING;
            LOGGER.info("Broker {} running with {} applications", this.serviceName,
                    this.endpoints.size());

        } catch (final IOException | ConfigurationException | RuntimeException ex) {
            LOGGER.error("Broker startup failed: {}", ex.getMessage());
            release();
            throw ex;
        }
    }

    /**
     * Blocks until the broker is closed. Calls are dispatched by the bus meanwhile.
     *
     * @throws InterruptedException
     *             if the calling thread is interrupted while waiting
     */
    public void run() throws InterruptedException {
        Preconditions.checkState(this.state != State.UNINITIALIZED, "Broker not initialized");
        this.terminated.await();
    }

    /**
     * Waits for the broker to be closed, at most for the time specified.
     *
     * @param timeout
     *            the maximum time to wait
     * @param unit
     *            the unit of the timeout
     * @return true if the broker has been closed, false if the timeout expired
     * @throws InterruptedException
     *             if the calling thread is interrupted while waiting
     */
    public boolean awaitTermination(final long timeout, final TimeUnit unit)
            throws InterruptedException {
        return this.terminated.await(timeout, unit);
    }

    /**
     * Returns the names of the registered applications, in alphabetical order.
     *
     * @return the application names
     */
    public synchronized List<String> getApplicationNames() {
        return Ordering.natural().immutableSortedCopy(this.endpoints.keySet());
    }

    @Nullable
    public synchronized ApplicationEndpoint getEndpoint(final String applicationName) {
        return this.endpoints.get(applicationName);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (this.state == State.STOPPED || this.state == State.SHUTTING_DOWN) {
                return;
            }
            if (this.state == State.RUNNING) {
                this.state = State.SHUTTING_DOWN;
                LOGGER.info("Broker {} shutting down", this.serviceName);
            }
            release();
        }
    }

    private void release() {
        final List<ApplicationEndpoint> endpoints = Lists.reverse(ImmutableList
                .copyOf(this.endpoints.values()));
        for (final ApplicationEndpoint endpoint : endpoints) {
            try {
                endpoint.unexport();
            } catch (final Throwable ex) {
                LOGGER.error("Could not unexport " + endpoint, ex);
            }
        }
        this.endpoints.clear();
        if (this.nameAcquired) {
            this.nameAcquired = false;
            try {
                this.bus.releaseName(this.serviceName);
            } catch (final BusException | RuntimeException ex) {
                LOGGER.warn("Could not release name {}: {}", this.serviceName, ex.toString());
            }
        }
        this.state = State.STOPPED;
        this.terminated.countDown();
    }

    @Override
    public String toString() {
        return "Broker[" + this.serviceName + ", " + this.state + "]";
    }

    /**
     * The states of a broker.
     */
    public enum State {

        UNINITIALIZED,

        SCANNING_CONFIG_DIR,

        REGISTERING,

        RUNNING,

        SHUTTING_DOWN,

        STOPPED

    }

}
