package eu.fbk.confman.bus;

import java.io.IOException;
import java.util.concurrent.ExecutionException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import eu.fbk.confman.ConfigurationException;

/**
 * Signals the failure of a bus operation, either in the bus itself or in the remote handler of
 * a method call.
 * <p>
 * Failures are identified by an error name, following D-Bus conventions. The standard names used
 * by the bus are available as constants; failures of remote handlers carry the name derived by
 * {@link #forFailure(Throwable)}.
 * </p>
 */
public class BusException extends IOException {

    private static final long serialVersionUID = 1L;

    private static final String PREFIX = "org.freedesktop.DBus.Error.";

    /** No object is exported at the path specified. */
    public static final String UNKNOWN_OBJECT = PREFIX + "UnknownObject";

    /** The object does not implement the interface specified. */
    public static final String UNKNOWN_INTERFACE = PREFIX + "UnknownInterface";

    /** The interface has no such method. */
    public static final String UNKNOWN_METHOD = PREFIX + "UnknownMethod";

    /** The destination name is not owned by anyone. */
    public static final String SERVICE_UNKNOWN = PREFIX + "ServiceUnknown";

    /** The name or object path is already taken. */
    public static final String ADDRESS_IN_USE = PREFIX + "AddressInUse";

    /** The arguments of a call are not the expected ones. */
    public static final String INVALID_ARGS = PREFIX + "InvalidArgs";

    /** No reply was received within the call timeout. */
    public static final String NO_REPLY = PREFIX + "NoReply";

    /** The bus cannot be reached. */
    public static final String NO_SERVER = PREFIX + "NoServer";

    /** The operation is not supported by this bus implementation. */
    public static final String NOT_SUPPORTED = PREFIX + "NotSupported";

    /** Generic failure. */
    public static final String FAILED = PREFIX + "Failed";

    private final String errorName;

    public BusException(final String errorName, @Nullable final String message) {
        this(errorName, message, null);
    }

    public BusException(final String errorName, @Nullable final String message,
            @Nullable final Throwable cause) {
        super(message, cause);
        this.errorName = Preconditions.checkNotNull(errorName);
    }

    /**
     * Converts the failure of a method handler into the exception returned to the caller.
     * {@code BusException}s are returned unchanged, {@code ConfigurationException}s get the
     * error name of their kind, {@code IllegalArgumentException}s become {@link #INVALID_ARGS}
     * and anything else {@link #FAILED}.
     *
     * @param failure
     *            the failure
     * @return the corresponding {@code BusException}
     */
    public static BusException forFailure(final Throwable failure) {
        Throwable ex = failure;
        while (ex instanceof ExecutionException && ex.getCause() != null) {
            ex = ex.getCause();
        }
        if (ex instanceof BusException) {
            return (BusException) ex;
        } else if (ex instanceof ConfigurationException) {
            return new BusException(((ConfigurationException) ex).getKind().getErrorName(),
                    ex.getMessage(), ex);
        } else if (ex instanceof IllegalArgumentException) {
            return new BusException(INVALID_ARGS, ex.getMessage(), ex);
        }
        return new BusException(FAILED, ex.toString(), ex);
    }

    public final String getErrorName() {
        return this.errorName;
    }

    @Override
    public String toString() {
        final String message = getMessage();
        return this.errorName + (message == null ? "" : ": " + message);
    }

}
