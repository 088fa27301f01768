package eu.fbk.confman.client;

import java.nio.file.Path;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.data.ConfigFile;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

/**
 * The local copy of the client settings, shared by the notification handler and the worker.
 * <p>
 * Two settings are kept: the {@value #KEY_TIMEOUT} interval in milliseconds, a 64-bit integer
 * greater than zero, and the {@value #KEY_PHRASE} string. Both are guarded by one lock, held
 * only while reading or writing the two fields. Snapshots are applied key by key: a malformed
 * value is logged and leaves that setting unchanged, without affecting the other one. Applying
 * the same snapshot more than once has no further effect.
 * </p>
 */
public final class ClientCache implements ConfigurationListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientCache.class);

    public static final String KEY_TIMEOUT = "Timeout";

    public static final String KEY_PHRASE = "TimeoutPhrase";

    public static final long DEFAULT_TIMEOUT = 1000L;

    public static final String DEFAULT_PHRASE = "Hey";

    private final Lock lock;

    private long timeout;

    private String phrase;

    public ClientCache() {
        this(DEFAULT_TIMEOUT, DEFAULT_PHRASE);
    }

    public ClientCache(final long timeout, final String phrase) {
        Preconditions.checkArgument(timeout > 0, "Invalid timeout %s", timeout);
        this.lock = new ReentrantLock();
        this.timeout = timeout;
        this.phrase = Preconditions.checkNotNull(phrase);
    }

    /**
     * Initializes the cache from the local configuration file, creating the file with the
     * current settings if missing or if {@code force} is true.
     *
     * @param path
     *            the local configuration file
     * @param force
     *            true to overwrite an existing file
     * @return the configuration loaded or created
     * @throws ConfigurationException
     *             if the file cannot be read or created
     */
    public ConfigMap initialize(final Path path, final boolean force)
            throws ConfigurationException {
        final ConfigMap configuration = ConfigFile.loadOrCreate(path, toConfigMap(), force);
        apply(configuration);
        return configuration;
    }

    /**
     * Applies a configuration snapshot. Keys other than {@value #KEY_TIMEOUT} and
     * {@value #KEY_PHRASE} are ignored.
     *
     * @param configuration
     *            the snapshot
     */
    public void apply(final ConfigMap configuration) {
        final ConfigValue timeoutValue = configuration.get(KEY_TIMEOUT);
        final ConfigValue phraseValue = configuration.get(KEY_PHRASE);
        final long timeout;
        final String phrase;
        this.lock.lock();
        try {
            if (timeoutValue != null) {
                if (timeoutValue.isLong() && timeoutValue.asLong() > 0) {
                    this.timeout = timeoutValue.asLong();
                } else {
                    LOGGER.error("Cannot apply {}: {} is not a positive integer", KEY_TIMEOUT,
                            timeoutValue);
                }
            }
            if (phraseValue != null) {
                if (phraseValue.isString()) {
                    this.phrase = phraseValue.asString();
                } else {
                    LOGGER.error("Cannot apply {}: {} is not a string", KEY_PHRASE,
                            phraseValue);
                }
            }
            timeout = this.timeout;
            phrase = this.phrase;
        } finally {
            this.lock.unlock();
        }
        LOGGER.info("Configuration applied: {}={}ms, {}='{}'", KEY_TIMEOUT, timeout,
                KEY_PHRASE, phrase);
    }

    @Override
    public void configurationChanged(final ConfigMap configuration) {
        LOGGER.debug("Configuration change received: {}", configuration);
        apply(configuration);
    }

    public long getTimeout() {
        this.lock.lock();
        try {
            return this.timeout;
        } finally {
            this.lock.unlock();
        }
    }

    public String getPhrase() {
        this.lock.lock();
        try {
            return this.phrase;
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * Returns the current settings as a configuration map.
     *
     * @return a map with the {@value #KEY_TIMEOUT} and {@value #KEY_PHRASE} keys
     */
    public ConfigMap toConfigMap() {
        this.lock.lock();
        try {
            return ConfigMap.builder().put(KEY_TIMEOUT, this.timeout)
                    .put(KEY_PHRASE, this.phrase).build();
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "ClientCache[" + getTimeout() + "ms, '" + getPhrase() + "']";
    }

}
