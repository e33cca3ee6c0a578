package com.nayem.fluxion.action;

/**
 * The work of an action. May return a plain value, {@code null}, or a
 * {@link java.util.concurrent.CompletionStage} whose value becomes the result.
 */
@FunctionalInterface
public interface ActionBody {
    Object execute() throws Throwable;
}
