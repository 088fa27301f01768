/**
 * Message bus abstraction used to publish configurations to other processes.
 * <p>
 * A {@link eu.fbk.confman.bus.Bus} offers D-Bus like primitives: well-known name ownership,
 * objects exported at {@link eu.fbk.confman.bus.ObjectPath}s under named interfaces, method
 * calls with a single reply or error, and broadcast signals delivered to matching
 * subscriptions. Call and signal arguments are restricted to {@code String}s,
 * {@link eu.fbk.confman.data.ConfigValue}s and {@link eu.fbk.confman.data.ConfigMap}s. The
 * in-process {@link eu.fbk.confman.bus.LocalBus} is the reference implementation; other
 * implementations bridge it across processes.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.bus;

