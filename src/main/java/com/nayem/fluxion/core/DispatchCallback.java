package com.nayem.fluxion.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * A callback registered with a {@link Dispatcher}.
 * <p>
 * The callback may finish synchronously (return {@code null} or an already
 * completed stage) or asynchronously. The dispatcher does not advance to the
 * next callback of the broadcast until the returned stage has settled.
 * Anything thrown from {@link #onDispatch(Object)} is captured as a failed
 * settlement instead of propagating to the caller of {@code dispatch}.
 * </p>
 *
 * @param <P> the payload type
 */
@FunctionalInterface
public interface DispatchCallback<P> {

    /**
     * Handles one broadcast payload.
     *
     * @param payload the payload passed unchanged to every callback
     * @return a stage that settles when handling is done, or {@code null}
     * @throws Exception any failure, reported as a rejection of the broadcast
     */
    CompletionStage<?> onDispatch(P payload) throws Exception;

    /**
     * Adapts a synchronous consumer.
     */
    static <P> DispatchCallback<P> of(Consumer<? super P> consumer) {
        return payload -> {
            consumer.accept(payload);
            return CompletableFuture.completedFuture(null);
        };
    }
}
