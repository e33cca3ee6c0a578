package com.nayem.fluxion.action;

/**
 * Completes the future of an action whose lifecycle failed, after the failure
 * broadcasts have been sent.
 */
public class ActionFailedException extends RuntimeException {

    private final ActionFailure failure;

    public ActionFailedException(ActionFailure failure) {
        super("Action " + failure.actionType() + " failed in " + failure.origin().name().toLowerCase()
                + " phase: " + failure.error().getMessage(), failure.error());
        this.failure = failure;
    }

    public ActionFailure getFailure() {
        return failure;
    }
}
