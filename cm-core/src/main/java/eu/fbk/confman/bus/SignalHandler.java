package eu.fbk.confman.bus;

/**
 * Receives the signals matching a subscription. Invoked by the bus on a dedicated delivery
 * thread; implementations must not block.
 */
public interface SignalHandler {

    void handle(Signal signal);

}
