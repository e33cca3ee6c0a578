package com.nayem.fluxion.action;

/**
 * Naming of the broadcasts emitted around one action.
 */
public final class ActionTypes {

    public static final String ACTION_FAILED = "ACTION_FAILED";

    private static final String BEFORE = ":before";
    private static final String AFTER = ":after";
    private static final String FAILED = ":failed";

    private ActionTypes() {
    }

    public static String before(String actionType) {
        return actionType + BEFORE;
    }

    public static String after(String actionType) {
        return actionType + AFTER;
    }

    public static String failed(String actionType) {
        return actionType + FAILED;
    }
}
