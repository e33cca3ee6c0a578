package com.nayem.fluxion.core;

/**
 * Thrown when {@code waitFor} is used while no broadcast is open.
 */
public class NotDispatchingException extends DispatchException {

    public NotDispatchingException() {
        super("Dispatcher.waitFor(...): Must be invoked while dispatching.");
    }
}
