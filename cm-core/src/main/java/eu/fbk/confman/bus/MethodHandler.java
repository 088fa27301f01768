package eu.fbk.confman.bus;

import javax.annotation.Nullable;

/**
 * Serves the method calls addressed to an exported object. Invoked concurrently by the bus.
 */
public interface MethodHandler {

    /**
     * Handles a method call.
     *
     * @param call
     *            the call
     * @return the reply, null for methods without one
     * @throws Exception
     *             on failure; the exception is returned to the caller as a {@link BusException}
     *             (see {@link BusException#forFailure(Throwable)})
     */
    @Nullable
    Object handle(MethodCall call) throws Exception;

}
