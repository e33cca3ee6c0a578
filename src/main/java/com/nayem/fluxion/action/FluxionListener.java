package com.nayem.fluxion.action;

import java.util.concurrent.CompletionStage;

/**
 * A subscriber to action broadcasts, typically a store.
 * <p>
 * Listeners registered through {@link ListenerRegistry} are invoked for every
 * broadcast whose type they {@link #accepts(String) accept}.
 * </p>
 */
public interface FluxionListener {

    /**
     * @return a stage that settles when handling is done, or {@code null}
     */
    CompletionStage<?> onEvent(ActionEvent event) throws Exception;

    default boolean accepts(String actionType) {
        return true;
    }
}
