package eu.fbk.confman.data;

import java.io.Serializable;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * A configuration value: a string, a 64-bit signed integer, a double or a boolean.
 * <p>
 * Instances are immutable and are created with the {@code of()} factory methods or with
 * {@link #valueOf(Object)}, which rejects any other Java type instead of coercing it. Values are
 * strictly typed: {@code of(500L)} and {@code of(500.0)} are different values. The typed
 * accessors ({@link #asString()}, {@link #asLong()}, {@link #asDouble()}, {@link #asBoolean()})
 * fail with an {@code IllegalStateException} if the value has a different type.
 * </p>
 */
public final class ConfigValue implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final ConfigValue TRUE = new ConfigValue(Type.BOOLEAN, Boolean.TRUE);

    private static final ConfigValue FALSE = new ConfigValue(Type.BOOLEAN, Boolean.FALSE);

    private final Type type;

    private final Object value;

    private ConfigValue(final Type type, final Object value) {
        this.type = type;
        this.value = value;
    }

    public static ConfigValue of(final String value) {
        return new ConfigValue(Type.STRING, Preconditions.checkNotNull(value));
    }

    public static ConfigValue of(final long value) {
        return new ConfigValue(Type.INT64, value);
    }

    /**
     * Returns the double value specified, which must be finite: NaN and infinities have no JSON
     * representation.
     *
     * @param value
     *            the value
     * @return the corresponding configuration value
     * @throws IllegalArgumentException
     *             if the value is not finite
     */
    public static ConfigValue of(final double value) throws IllegalArgumentException {
        Preconditions.checkArgument(Double.isFinite(value), "Non-finite double %s", value);
        return new ConfigValue(Type.DOUBLE, value);
    }

    public static ConfigValue of(final boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Converts a Java object to a configuration value. Accepted inputs are {@code ConfigValue}s
     * (returned unchanged), {@code String}s, {@code Long}s, {@code Integer}s, {@code Short}s,
     * {@code Byte}s, {@code Double}s, {@code Float}s and {@code Boolean}s.
     *
     * @param object
     *            the object to convert
     * @return the corresponding value
     * @throws IllegalArgumentException
     *             if the object is null, has an unsupported type or is a non-finite number
     */
    public static ConfigValue valueOf(@Nullable final Object object)
            throws IllegalArgumentException {
        if (object instanceof ConfigValue) {
            return (ConfigValue) object;
        } else if (object instanceof String) {
            return of((String) object);
        } else if (object instanceof Long || object instanceof Integer
                || object instanceof Short || object instanceof Byte) {
            return of(((Number) object).longValue());
        } else if (object instanceof Double || object instanceof Float) {
            return of(((Number) object).doubleValue());
        } else if (object instanceof Boolean) {
            return of(((Boolean) object).booleanValue());
        } else if (object == null) {
            throw new IllegalArgumentException("Missing value");
        }
        throw new IllegalArgumentException("Unsupported value type "
                + object.getClass().getSimpleName() + ": " + object);
    }

    public Type getType() {
        return this.type;
    }

    public boolean isString() {
        return this.type == Type.STRING;
    }

    public boolean isLong() {
        return this.type == Type.INT64;
    }

    public boolean isDouble() {
        return this.type == Type.DOUBLE;
    }

    public boolean isBoolean() {
        return this.type == Type.BOOLEAN;
    }

    public String asString() {
        checkType(Type.STRING);
        return (String) this.value;
    }

    public long asLong() {
        checkType(Type.INT64);
        return (Long) this.value;
    }

    public double asDouble() {
        checkType(Type.DOUBLE);
        return (Double) this.value;
    }

    public boolean asBoolean() {
        checkType(Type.BOOLEAN);
        return (Boolean) this.value;
    }

    /**
     * Returns the wrapped Java object: a {@code String}, {@code Long}, {@code Double} or
     * {@code Boolean} depending on the type.
     *
     * @return the wrapped object
     */
    public Object getObject() {
        return this.value;
    }

    private void checkType(final Type expected) {
        if (this.type != expected) {
            throw new IllegalStateException("Expected " + expected.getLabel() + " value, got "
                    + this.type.getLabel() + " value " + this);
        }
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof ConfigValue)) {
            return false;
        }
        final ConfigValue other = (ConfigValue) object;
        return this.type == other.type && this.value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return this.type.hashCode() * 37 + this.value.hashCode();
    }

    /**
     * {@inheritDoc} Strings are returned quoted, other values in their JSON form.
     */
    @Override
    public String toString() {
        return this.type == Type.STRING ? "\"" + this.value + "\"" : this.value.toString();
    }

    /**
     * The supported value types.
     */
    public enum Type {

        STRING("string"),

        INT64("int64"),

        DOUBLE("double"),

        BOOLEAN("boolean");

        private final String label;

        private Type(final String label) {
            this.label = label;
        }

        public String getLabel() {
            return this.label;
        }

    }

}
