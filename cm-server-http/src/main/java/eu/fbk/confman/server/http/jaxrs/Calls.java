package eu.fbk.confman.server.http.jaxrs;

import javax.ws.rs.Consumes;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.confman.bus.Bus;
import eu.fbk.confman.bus.BusException;
import eu.fbk.confman.bus.MethodCall;
import eu.fbk.confman.internal.jaxrs.Protocol;

/**
 * Forwards the method calls POSTed by remote clients to the bus.
 */
@Path("/" + Protocol.PATH_CALL)
public final class Calls {

    private static final Logger LOGGER = LoggerFactory.getLogger(Calls.class);

    private final Bus bus;

    public Calls(final Bus bus) {
        this.bus = Preconditions.checkNotNull(bus);
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response call(final String body) {
        try {
            final MethodCall call = Protocol.decodeCall(body);
            final Object result = this.bus.call(call);
            return Response.ok(Protocol.encodeReply(result), MediaType.APPLICATION_JSON_TYPE)
                    .build();

        } catch (final BusException ex) {
            final int status = Protocol.statusFor(ex.getErrorName());
            LOGGER.debug("Returning {} for {}", status, ex);
            return Response.status(status).entity(Protocol.encodeError(ex))
                    .type(MediaType.APPLICATION_JSON_TYPE).build();
        }
    }

}
