package eu.fbk.confman.bus;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import eu.fbk.confman.data.ConfigMap;
import eu.fbk.confman.data.ConfigValue;

/**
 * Base class of the messages exchanged on a {@link Bus}: a member of an interface of the object
 * at some path, plus arguments.
 */
public abstract class Message {

    private final ObjectPath path;

    private final String interfaceName;

    private final String member;

    private final List<Object> args;

    Message(final ObjectPath path, final String interfaceName, final String member,
            final Object... args) {
        Preconditions.checkArgument(!interfaceName.isEmpty(), "Empty interface name");
        Preconditions.checkArgument(!member.isEmpty(), "Empty member name");
        for (final Object arg : args) {
            checkArgument(arg);
        }
        this.path = Preconditions.checkNotNull(path);
        this.interfaceName = interfaceName;
        this.member = member;
        this.args = ImmutableList.copyOf(args);
    }

    /**
     * Checks that an object may travel as a message argument or a reply.
     *
     * @param arg
     *            the object
     * @return the object
     * @throws IllegalArgumentException
     *             if the object is not a {@code String}, {@code ConfigValue} or
     *             {@code ConfigMap}
     */
    public static Object checkArgument(final Object arg) {
        Preconditions.checkArgument(arg instanceof String || arg instanceof ConfigValue
                || arg instanceof ConfigMap, "Unsupported argument %s", arg);
        return arg;
    }

    public final ObjectPath getPath() {
        return this.path;
    }

    public final String getInterfaceName() {
        return this.interfaceName;
    }

    public final String getMember() {
        return this.member;
    }

    public final List<Object> getArgs() {
        return this.args;
    }

    /**
     * Returns an argument with the type specified.
     *
     * @param index
     *            the argument index
     * @param type
     *            the expected type
     * @return the argument
     * @throws IllegalArgumentException
     *             if the argument is missing or has another type
     */
    public final <T> T getArg(final int index, final Class<T> type) {
        Preconditions.checkArgument(index < this.args.size(), "Missing argument #%s of %s",
                index, this.member);
        final Object arg = this.args.get(index);
        Preconditions.checkArgument(type.isInstance(arg), "Argument #%s of %s is not a %s: %s",
                index, this.member, type.getSimpleName(), arg);
        return type.cast(arg);
    }

    @Override
    public String toString() {
        return this.interfaceName + "." + this.member + "(" + Joiner.on(", ").join(this.args)
                + ") @ " + this.path;
    }

}
