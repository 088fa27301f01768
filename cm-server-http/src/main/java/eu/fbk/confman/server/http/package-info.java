/**
 * HTTP gateway of the configuration broker ({@code cm-server-http}).
 * <p>
 * {@link eu.fbk.confman.server.http.HttpBusServer} publishes a {@link eu.fbk.confman.bus.Bus}
 * to other processes using Jetty and Jersey; {@link eu.fbk.confman.server.http.Launcher} is the
 * command line entry point starting a broker together with its gateway.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.server.http;
