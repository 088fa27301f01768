/**
 * Internal helpers shared by the modules of the configuration manager. Not part of the public
 * API.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.internal;

