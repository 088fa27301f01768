package eu.fbk.confman.runtime;

import java.io.Closeable;
import java.io.IOException;

import eu.fbk.confman.ConfigurationException;

/**
 * A configuration manager component, such as the broker or a bus gateway.
 * <p>
 * The <i>lifecycle</i> of a {@code Component} is the following:
 * <ul>
 * <li>The {@code Component} instance is created and configures itself based on the arguments of
 * its constructor. The component is now configured, but still inactive, meaning that no activity
 * is being carried out, no file is being modified and no resource that needs to be later freed
 * is being allocated.</li>
 * <li>Method {@link #init()} is called to make the component operational; differently from the
 * constructor, {@code init()} is allowed to allocate resources, claim names and ports, and start
 * any task as necessary for the component to perform its job.</li>
 * <li>Method {@link #close()} is called to dispose the {@code Component}, allowing it to free
 * allocated resources in an orderly way. It can be called at any time after instantiation, also
 * before initialization or while another thread is using the component, and has no effect if
 * called again.</li>
 * </ul>
 * </p>
 */
public interface Component extends Closeable {

    /**
     * Initializes the {@code Component}. This method is called once after instantiation and
     * before any other method is called. On failure, the component releases what it has
     * acquired so far before throwing.
     *
     * @throws IOException
     *             in case initialization fails due to the bus or the network
     * @throws ConfigurationException
     *             in case initialization fails due to the configuration files
     * @throws IllegalStateException
     *             in case the component has already been initialized or closed
     */
    void init() throws IOException, ConfigurationException, IllegalStateException;

    /**
     * Closes this {@code Component}, releasing its resources. Calling this method on a component
     * not yet initialized or already closed has no effect.
     */
    @Override
    void close();

}
