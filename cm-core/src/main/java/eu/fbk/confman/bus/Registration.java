package eu.fbk.confman.bus;

/**
 * An object exported on a {@link Bus}, returned by
 * {@link Bus#exportObject(ObjectPath, String, MethodHandler)}.
 */
public interface Registration {

    ObjectPath getPath();

    String getInterfaceName();

    /**
     * Withdraws the object from the bus. Calling it again has no effect.
     */
    void unregister();

}
