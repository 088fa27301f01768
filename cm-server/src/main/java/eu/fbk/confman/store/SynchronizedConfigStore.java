package eu.fbk.confman.store;

import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

/**
 * A {@code ConfigStore} wrapper that serializes the access to another {@code ConfigStore}.
 * <p>
 * Every operation is executed while holding a lock owned by this wrapper, one per application,
 * so operations on different stores never contend. The lock is held for the whole operation of
 * the wrapped store, including the notification and the file write of its inner decorators, so
 * that notifications and writes are ordered as the changes they refer to.
 * </p>
 */
public final class SynchronizedConfigStore extends ForwardingConfigStore {

    private final ConfigStore delegate;

    private final ReentrantLock lock;

    public SynchronizedConfigStore(final ConfigStore delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        this.lock = new ReentrantLock();
    }

    @Override
    protected ConfigStore delegate() {
        return this.delegate;
    }

    @Override
    public ConfigMap getAll() {
        this.lock.lock();
        try {
            return super.getAll();
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public void set(final String key, @Nullable final ConfigValue value)
            throws ConfigurationException {
        this.lock.lock();
        try {
            super.set(key, value);
        } finally {
            this.lock.unlock();
        }
    }

}
