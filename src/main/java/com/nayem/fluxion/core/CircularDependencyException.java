package com.nayem.fluxion.core;

/**
 * Thrown when {@code waitFor} names a callback that is itself still executing
 * in the open broadcast, directly or through a chain of {@code waitFor} calls.
 */
public class CircularDependencyException extends DispatchException {

    private final DispatchToken token;

    public CircularDependencyException(DispatchToken token) {
        super("Dispatcher.waitFor(...): Circular dependency detected while waiting for `" + token + "`.");
        this.token = token;
    }

    public DispatchToken getToken() {
        return token;
    }
}
