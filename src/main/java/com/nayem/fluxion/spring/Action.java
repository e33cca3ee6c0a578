package com.nayem.fluxion.spring;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean method as a Fluxion action.
 * <p>
 * Invocations are routed through {@link com.nayem.fluxion.action.ActionRunner}:
 * the {@code :before} broadcast is sent with the method arguments, the method
 * runs, and its result is broadcast to listeners followed by {@code :after}.
 * Failures are broadcast as {@code :failed} and
 * {@value com.nayem.fluxion.action.ActionTypes#ACTION_FAILED}.
 * </p>
 *
 * <h3>Usage Example</h3>
 *
 * <pre>{@code
 * @Service
 * public class CartActions {
 *
 *     @Action("cart.add")
 *     public CompletableFuture<Item> add(String sku) {
 *         return catalog.lookup(sku);
 *     }
 * }
 * }</pre>
 *
 * <h3>Return Values</h3>
 * Methods declared to return a {@link java.util.concurrent.CompletionStage}
 * (or {@link java.util.concurrent.CompletableFuture}) receive the action's
 * future and never block. Other methods block the caller until the lifecycle
 * completes, bounded by {@code fluxion.action.block-timeout}; do not call such
 * methods from inside a dispatcher callback, since their broadcasts queue
 * behind the one that is running.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Action {

    /**
     * The action type. Defaults to {@code simpleClassName.methodName}.
     */
    String value() default "";
}
