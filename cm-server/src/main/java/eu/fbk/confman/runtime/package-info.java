/**
 * Lifecycle of the components of a configuration manager process.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.runtime;

