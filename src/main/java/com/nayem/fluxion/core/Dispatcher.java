package com.nayem.fluxion.core;

import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;

/**
 * Broadcasts payloads to registered callbacks, one broadcast at a time.
 * <p>
 * Broadcasts requested while another one is open are queued and run strictly
 * in arrival order once the open broadcast has fully completed, so callbacks
 * of two payloads never interleave.
 * </p>
 *
 * @param <P> the payload type
 */
public interface Dispatcher<P> {

    /**
     * Registers a callback for all future broadcasts.
     *
     * @return the token identifying the registration
     */
    DispatchToken register(DispatchCallback<P> callback);

    /**
     * Removes a registration. Unknown tokens are ignored. A callback that is
     * currently executing finishes normally.
     */
    void unregister(DispatchToken token);

    /**
     * Broadcasts the payload to every registered callback in registration
     * order.
     *
     * @return a future that completes once the broadcast has run, or fails
     *         with the first callback failure
     */
    CompletableFuture<Void> dispatch(P payload);

    /**
     * Runs the given callbacks of the open broadcast before returning control.
     * Must be called from within a callback.
     *
     * @return a future that completes once every requested callback has run
     */
    CompletableFuture<Void> waitFor(Collection<DispatchToken> tokens);

    default CompletableFuture<Void> waitFor(DispatchToken... tokens) {
        return waitFor(Arrays.asList(tokens));
    }

    boolean isDispatching();
}
