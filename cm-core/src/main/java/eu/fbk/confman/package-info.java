/**
 * Configuration manager core API ({@code cm-core}).
 * <p>
 * A configuration manager (or <i>broker</i>) owns one JSON configuration document per
 * registered application and publishes it on a message bus under the service name
 * {@link eu.fbk.confman.Names#DEFAULT_SERVICE_NAME}. Each application is exposed as an object
 * at path {@code /com/system/configurationManager/Application/<name>} implementing the
 * {@link eu.fbk.confman.Configuration} interface: clients may read the whole configuration,
 * change a single key, and subscribe to the {@code ConfigurationChanged} signal that carries the
 * complete configuration after every successful change.
 * </p>
 * <p>
 * Values are modeled by {@link eu.fbk.confman.data.ConfigValue} (string, 64-bit integer, double
 * or boolean) and whole configurations by the immutable {@link eu.fbk.confman.data.ConfigMap}.
 * The bus abstraction lives in package {@link eu.fbk.confman.bus}. Failures are reported as
 * {@link eu.fbk.confman.ConfigurationException}s classified by kind.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman;

