package eu.fbk.confman.client;

import java.io.PrintStream;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Uninterruptibles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The periodic activity of the client: sleeps for the current timeout, then prints the current
 * phrase, until stopped.
 * <p>
 * Both settings are read from the {@link ClientCache} at every cycle, so a change of the timeout
 * affects the cycle following the one in progress.
 * </p>
 */
public final class TimeoutWorker {

    private static final Logger LOGGER = LoggerFactory.getLogger(TimeoutWorker.class);

    private final ClientCache cache;

    private final PrintStream out;

    private volatile boolean running;

    @Nullable
    private Thread thread;

    public TimeoutWorker(final ClientCache cache, final PrintStream out) {
        this.cache = Preconditions.checkNotNull(cache);
        this.out = Preconditions.checkNotNull(out);
        this.running = false;
        this.thread = null;
    }

    public synchronized void start() {
        Preconditions.checkState(this.thread == null, "Worker already started");
        this.running = true;
        this.thread = new Thread("timeout-worker") {

            @Override
            public void run() {
                loop();
            }

        };
        this.thread.setDaemon(true);
        this.thread.start();
        LOGGER.debug("Worker started");
    }

    public boolean isRunning() {
        return this.running;
    }

    /**
     * Stops the worker and waits for its thread to terminate. Calling this method on a worker
     * not started or already stopped has no effect.
     */
    public void stop() {
        final Thread thread;
        synchronized (this) {
            thread = this.thread;
            if (thread == null || !this.running) {
                return;
            }
            this.running = false;
            thread.interrupt();
        }
        Uninterruptibles.joinUninterruptibly(thread);
        LOGGER.debug("Worker stopped");
    }

    private void loop() {
        while (this.running) {
            try {
                Thread.sleep(this.cache.getTimeout());
            } catch (final InterruptedException ex) {
                LOGGER.debug("Worker interrupted, running: {}", this.running);
                continue;
            }
            if (!this.running) {
                break;
            }
            this.out.println(this.cache.getPhrase());
            this.out.flush();
        }
    }

}
