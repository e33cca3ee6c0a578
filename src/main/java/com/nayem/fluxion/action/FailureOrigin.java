package com.nayem.fluxion.action;

/**
 * Where in an action's lifecycle a failure was raised.
 */
public enum FailureOrigin {
    /**
     * The action body threw or returned a failed stage.
     */
    ACTION,

    /**
     * A listener of the action's result broadcast failed.
     */
    LISTENER,

    /**
     * A listener of the {@code :before} broadcast failed.
     */
    BEFORE,

    /**
     * A listener of the {@code :after} broadcast failed.
     */
    AFTER,

    /**
     * A listener of the {@code :failed} broadcast failed while handling an
     * earlier failure.
     */
    FAILED
}
