/**
 * The configuration client ({@code cm-client}).
 * <p>
 * A client keeps a {@link eu.fbk.confman.client.ClientCache} of its own configuration, reached
 * through a {@link eu.fbk.confman.client.ConfigurationProxy} on an
 * {@link eu.fbk.confman.client.HttpBus}, and applies it to a
 * {@link eu.fbk.confman.client.TimeoutWorker}.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.client;
