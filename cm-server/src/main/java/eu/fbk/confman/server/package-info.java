/**
 * The configuration broker ({@code cm-server}).
 * <p>
 * A {@link eu.fbk.confman.server.Broker} scans a configuration directory once at startup (see
 * {@link eu.fbk.confman.server.ConfigDirectory}) and publishes each discovered application on a
 * {@link eu.fbk.confman.bus.Bus} through an {@link eu.fbk.confman.server.ApplicationEndpoint}.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.server;

