/**
 * HTTP protocol shared by the bus gateway and its clients.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.internal.jaxrs;

