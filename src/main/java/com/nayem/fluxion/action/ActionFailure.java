package com.nayem.fluxion.action;

/**
 * Payload of the global failure broadcast.
 *
 * @param actionType the action that failed
 * @param error      the error being reported
 * @param origin     the phase that raised {@code error}
 */
public record ActionFailure(String actionType, Throwable error, FailureOrigin origin) {
}
