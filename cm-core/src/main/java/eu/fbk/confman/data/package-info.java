/**
 * Configuration data model: typed scalar values, immutable configuration maps, and their JSON
 * file representation.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.data;

