package eu.fbk.confman.bus;

/**
 * A subscription to the signals of a {@link Bus}, returned by
 * {@link Bus#subscribe(SignalMatch, SignalHandler)}.
 */
public interface Subscription {

    SignalMatch getMatch();

    boolean isCancelled();

    /**
     * Cancels the subscription. No signal is delivered to the handler after this method
     * returns, unless its delivery was already in progress. Calling it again has no effect.
     */
    void cancel();

}
