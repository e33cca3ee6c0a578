package com.nayem.fluxion.core;

/**
 * Base type for programming errors detected by the dispatcher itself.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }
}
