package com.nayem.fluxion.core;

import java.util.Objects;

/**
 * Opaque identifier handed out by {@link Dispatcher#register(DispatchCallback)}.
 * <p>
 * The token stays valid for the lifetime of the registration and is the only
 * handle accepted by {@link Dispatcher#unregister(DispatchToken)} and
 * {@link Dispatcher#waitFor(java.util.Collection)}.
 * </p>
 *
 * @param value the stringified identifier, e.g. {@code ID_7}
 */
public record DispatchToken(String value) {

    public DispatchToken {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
