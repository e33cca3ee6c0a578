package com.nayem.fluxion.core;

/**
 * Thrown when {@code waitFor} names a token with no registered callback.
 */
public class UnknownCallbackException extends DispatchException {

    private final DispatchToken token;

    public UnknownCallbackException(DispatchToken token) {
        super("Dispatcher.waitFor(...): `" + token + "` does not map to a registered callback.");
        this.token = token;
    }

    public DispatchToken getToken() {
        return token;
    }
}
