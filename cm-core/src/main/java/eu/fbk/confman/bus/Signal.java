package eu.fbk.confman.bus;

/**
 * A broadcast notification emitted by an exported object.
 */
public final class Signal extends Message {

    public Signal(final ObjectPath path, final String interfaceName, final String member,
            final Object... args) {
        super(path, interfaceName, member, args);
    }

}
