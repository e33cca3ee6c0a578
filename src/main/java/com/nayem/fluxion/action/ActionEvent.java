package com.nayem.fluxion.action;

import java.util.Objects;

/**
 * Payload broadcast by the action layer.
 *
 * @param actionType the broadcast type, e.g. {@code cart.add:before}
 * @param payload    the arguments, result or failure for that broadcast
 */
public record ActionEvent(String actionType, Object payload) {

    public ActionEvent {
        Objects.requireNonNull(actionType, "actionType");
    }

    public boolean is(String type) {
        return actionType.equals(type);
    }
}
