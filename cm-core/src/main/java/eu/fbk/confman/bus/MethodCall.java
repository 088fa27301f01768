package eu.fbk.confman.bus;

import javax.annotation.Nullable;

/**
 * A method call addressed to the object exported at some path by the owner of a bus name.
 */
public final class MethodCall extends Message {

    @Nullable
    private final String destination;

    public MethodCall(@Nullable final String destination, final ObjectPath path,
            final String interfaceName, final String member, final Object... args) {
        super(path, interfaceName, member, args);
        this.destination = destination;
    }

    /**
     * Returns the bus name of the recipient. A null destination addresses whichever object is
     * exported at the path on the bus.
     *
     * @return the destination name, possibly null
     */
    @Nullable
    public String getDestination() {
        return this.destination;
    }

    @Override
    public String toString() {
        return (this.destination == null ? "" : this.destination + ": ") + super.toString();
    }

}
