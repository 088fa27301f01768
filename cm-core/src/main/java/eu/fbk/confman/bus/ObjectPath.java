package eu.fbk.confman.bus;

import java.io.Serializable;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

/**
 * The path of an object exported on a {@link Bus}, e.g. {@code /com/example/Object}.
 * <p>
 * A path is either the root {@code /} or a sequence of non-empty elements, each preceded by a
 * slash. Elements are made of ASCII letters, digits, {@code _}, {@code -} and {@code .}.
 * </p>
 */
public final class ObjectPath implements Serializable, Comparable<ObjectPath> {

    private static final long serialVersionUID = 1L;

    private static final Pattern ELEMENT = Pattern.compile("[A-Za-z0-9_.-]+");

    private static final Pattern PATH = Pattern.compile("/|(/[A-Za-z0-9_.-]+)+");

    /** The root path. */
    public static final ObjectPath ROOT = new ObjectPath("/");

    private final String path;

    private ObjectPath(final String path) {
        this.path = path;
    }

    /**
     * Parses an object path.
     *
     * @param path
     *            the path string
     * @return the corresponding path
     * @throws IllegalArgumentException
     *             if the string is not a valid path
     */
    public static ObjectPath valueOf(final String path) {
        Preconditions.checkArgument(PATH.matcher(path).matches(), "Invalid object path '%s'",
                path);
        return path.equals("/") ? ROOT : new ObjectPath(path);
    }

    /**
     * Returns the path of the object publishing the configuration of an application, that is
     * the service name with dots replaced by slashes followed by {@code /Application/<name>}.
     *
     * @param serviceName
     *            the service name, e.g. {@code com.system.configurationManager}
     * @param applicationName
     *            the application name
     * @return the object path
     */
    public static ObjectPath forApplication(final String serviceName,
            final String applicationName) {
        return valueOf("/" + serviceName.replace('.', '/')).child("Application").child(
                applicationName);
    }

    /**
     * Returns whether a string can be used as an element of an object path.
     *
     * @param element
     *            the string
     * @return true if the string is a valid path element
     */
    public static boolean isValidElement(final String element) {
        return ELEMENT.matcher(element).matches();
    }

    public ObjectPath child(final String element) {
        Preconditions.checkArgument(ELEMENT.matcher(element).matches(),
                "Invalid object path element '%s'", element);
        return new ObjectPath(this == ROOT ? "/" + element : this.path + "/" + element);
    }

    public String getLastElement() {
        return this.path.substring(this.path.lastIndexOf('/') + 1);
    }

    @Override
    public int compareTo(final ObjectPath other) {
        return this.path.compareTo(other.path);
    }

    @Override
    public boolean equals(final Object object) {
        return object == this || object instanceof ObjectPath
                && this.path.equals(((ObjectPath) object).path);
    }

    @Override
    public int hashCode() {
        return this.path.hashCode();
    }

    @Override
    public String toString() {
        return this.path;
    }

}
