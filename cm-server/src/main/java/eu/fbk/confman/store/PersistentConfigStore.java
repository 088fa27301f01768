package eu.fbk.confman.store;

import java.nio.file.Path;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import eu.fbk.confman.ConfigurationException;
import eu.fbk.confman.data.ConfigFile;
import eu.fbk.confman.data.ConfigValue;

/**
 * A {@code ConfigStore} wrapper that saves the configuration to a file after every successful
 * change.
 * <p>
 * Write failures are logged and otherwise ignored: the in-memory configuration stays
 * authoritative and the change is not rolled back.
 * </p>
 */
public final class PersistentConfigStore extends ForwardingConfigStore {

    private final ConfigStore delegate;

    private final Path file;

    public PersistentConfigStore(final ConfigStore delegate, final Path file) {
        this.delegate = Preconditions.checkNotNull(delegate);
        this.file = Preconditions.checkNotNull(file);
    }

    @Override
    protected ConfigStore delegate() {
        return this.delegate;
    }

    @Override
    public void set(final String key, @Nullable final ConfigValue value)
            throws ConfigurationException {
        super.set(key, value);
        ConfigFile.saveQuietly(this.file, getAll());
    }

}
