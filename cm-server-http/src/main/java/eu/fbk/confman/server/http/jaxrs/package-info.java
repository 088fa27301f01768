/**
 * Bus Web API.
 * <p>
 * Two resources are exposed under the base URI of the gateway, using the encoding of
 * {@link eu.fbk.confman.internal.jaxrs.Protocol}:
 * </p>
 * <table border="1" style="width: 100%">
 * <tr>
 * <th>Request</th>
 * <th>Description</th>
 * </tr>
 * <tr>
 * <td>{@code POST /call}</td>
 * <td>Invokes a method on an exported object. The JSON body describes the call; the reply is
 * {@code 200} with the JSON result, or {@code 400}, {@code 404}, {@code 500}, {@code 504} with a
 * JSON error object.</td>
 * </tr>
 * <tr>
 * <td>{@code GET /signals?path=&interface=&member=}</td>
 * <td>Opens a stream of server-sent events. The first event is {@code Subscribed}; every
 * following event carries a signal matching the (optional) query parameters.</td>
 * </tr>
 * </table>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.confman.server.http.jaxrs;
