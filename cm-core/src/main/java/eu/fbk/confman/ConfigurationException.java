package eu.fbk.confman;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals the failure of a configuration operation.
 * <p>
 * Every failure reported by the configuration manager is classified by a {@link Kind}, returned
 * by {@link #getKind()}. Kinds are stable across process boundaries: each one is associated to a
 * remote error name ({@link Kind#getErrorName()}) that is used when the failure is returned over
 * the bus, so that a client proxy can re-create an exception of the same kind on its side (see
 * {@link Kind#forErrorName(String)}).
 * </p>
 */
public class ConfigurationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Kind kind;

    /**
     * Creates a new instance with the kind and error message specified.
     *
     * @param kind
     *            the kind of failure
     * @param message
     *            an optional error message
     */
    public ConfigurationException(final Kind kind, @Nullable final String message) {
        this(kind, message, null);
    }

    /**
     * Creates a new instance with the kind, error message and cause specified.
     *
     * @param kind
     *            the kind of failure
     * @param message
     *            an optional error message
     * @param cause
     *            the optional cause of this exception
     */
    public ConfigurationException(final Kind kind, @Nullable final String message,
            @Nullable final Throwable cause) {
        super(message, cause);
        this.kind = Preconditions.checkNotNull(kind);
    }

    /**
     * Returns the kind of failure.
     *
     * @return the kind
     */
    public final Kind getKind() {
        return this.kind;
    }

    @Override
    public String toString() {
        final String message = getMessage();
        return this.kind.getLabel() + (message == null ? "" : ": " + message);
    }

    /**
     * The kinds of configuration failures.
     */
    public enum Kind {

        /** A configuration file is missing or cannot be opened. */
        NOT_FOUND("NotFound"),

        /** The content of a configuration document is not a valid JSON object. */
        PARSE_ERROR("ParseError"),

        /** A value has a type other than string, 64-bit integer, double or boolean. */
        TYPE_ERROR("TypeError"),

        /** An empty key or an absent value has been supplied to a change. */
        INVALID_ARGUMENT("InvalidArgument"),

        /** The configuration directory cannot be accessed or created. */
        CONFIG_DIR_ERROR("ConfigDirError"),

        /** The configuration directory contains no eligible configuration file. */
        NO_CONFIGS_FOUND("NoConfigsFound"),

        /** The bus is unavailable or the remote party cannot be reached. */
        IPC_CONNECTION_ERROR("IpcConnectionError");

        private final String label;

        private Kind(final String label) {
            this.label = label;
        }

        /**
         * Returns the short name of this kind, e.g. {@code NotFound}.
         *
         * @return the label
         */
        public String getLabel() {
            return this.label;
        }

        /**
         * Returns the name under which failures of this kind travel over the bus.
         *
         * @return the remote error name
         */
        public String getErrorName() {
            return Names.ERROR_NAME_PREFIX + this.label;
        }

        /**
         * Returns the kind associated to the remote error name specified, if any.
         *
         * @param errorName
         *            the remote error name, possibly null
         * @return the corresponding kind, or null if the name does not denote a configuration
         *         failure
         */
        @Nullable
        public static Kind forErrorName(@Nullable final String errorName) {
            if (errorName != null && errorName.startsWith(Names.ERROR_NAME_PREFIX)) {
                final String label = errorName.substring(Names.ERROR_NAME_PREFIX.length());
                for (final Kind kind : values()) {
                    if (kind.label.equals(label)) {
                        return kind;
                    }
                }
            }
            return null;
        }

    }

}
