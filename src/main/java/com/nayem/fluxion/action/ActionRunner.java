package com.nayem.fluxion.action;

import com.nayem.fluxion.core.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Turns an action invocation into broadcasts on a {@link Dispatcher}.
 * <p>
 * An action {@code ns.name} runs as:
 * <ol>
 * <li>broadcast {@code ns.name:before} with the arguments</li>
 * <li>execute the action body</li>
 * <li>broadcast {@code ns.name} with the result</li>
 * <li>broadcast {@code ns.name:after} with the result</li>
 * </ol>
 * The first failure stops the sequence and is reported by broadcasting
 * {@code ns.name:failed} with the error and then the global failure type
 * (default {@value ActionTypes#ACTION_FAILED}) with an {@link ActionFailure}.
 * A failure inside the {@code :failed} broadcast replaces the reported error
 * and is tagged {@link FailureOrigin#FAILED}.
 * </p>
 * <p>
 * Nothing here blocks, so actions may be started from inside a dispatcher
 * callback; their broadcasts are queued behind the open one.
 * </p>
 */
public class ActionRunner {

    private static final Logger log = LoggerFactory.getLogger(ActionRunner.class);

    private final Dispatcher<ActionEvent> dispatcher;
    private final String failedEventType;

    public ActionRunner(Dispatcher<ActionEvent> dispatcher) {
        this(dispatcher, ActionTypes.ACTION_FAILED);
    }

    public ActionRunner(Dispatcher<ActionEvent> dispatcher, String failedEventType) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.failedEventType = Objects.requireNonNull(failedEventType, "failedEventType");
    }

    /**
     * Runs an action through its broadcast lifecycle.
     *
     * @param actionType the action name, e.g. {@code cart.add}
     * @param args       payload of the {@code :before} broadcast
     * @param body       the action itself
     * @return the action result, or a failure with {@link ActionFailedException}
     */
    public CompletableFuture<Object> run(String actionType, Object args, ActionBody body) {
        return phase(ActionTypes.before(actionType), args, FailureOrigin.BEFORE)
                .thenCompose(ignored -> execute(body))
                .thenCompose(result -> phase(actionType, result, FailureOrigin.LISTENER)
                        .thenApply(ignored -> result))
                .thenCompose(result -> phase(ActionTypes.after(actionType), result, FailureOrigin.AFTER)
                        .thenApply(ignored -> result))
                .exceptionallyCompose(error -> report(actionType, unwrap(error)));
    }

    public String getFailedEventType() {
        return failedEventType;
    }

    private CompletableFuture<Void> phase(String eventType, Object payload, FailureOrigin origin) {
        return dispatcher.dispatch(new ActionEvent(eventType, payload))
                .exceptionallyCompose(error -> CompletableFuture.<Void>failedFuture(
                        new PhaseFailure(unwrap(error), origin)));
    }

    private CompletableFuture<Object> execute(ActionBody body) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        try {
            Object value = body.execute();
            if (value instanceof CompletionStage<?> stage) {
                stage.whenComplete((resolved, error) -> {
                    if (error == null) {
                        result.complete(resolved);
                    } else {
                        result.completeExceptionally(new PhaseFailure(unwrap(error), FailureOrigin.ACTION));
                    }
                });
            } else {
                result.complete(value);
            }
        } catch (Throwable t) {
            result.completeExceptionally(new PhaseFailure(t, FailureOrigin.ACTION));
        }
        return result;
    }

    private CompletableFuture<Object> report(String actionType, Throwable error) {
        ActionFailure initial = error instanceof PhaseFailure phaseFailure
                ? new ActionFailure(actionType, phaseFailure.getCause(), phaseFailure.origin)
                : new ActionFailure(actionType, error, FailureOrigin.ACTION);

        log.warn("Action {} failed in {} phase: {}", actionType, initial.origin(), initial.error().toString());

        return dispatcher.dispatch(new ActionEvent(ActionTypes.failed(actionType), initial.error()))
                .handle((ignored, hookError) -> {
                    if (hookError == null) {
                        return initial;
                    }
                    Throwable cause = unwrap(hookError);
                    log.warn("Failure handler of action {} failed: {}", actionType, cause.toString());
                    return new ActionFailure(actionType, cause, FailureOrigin.FAILED);
                })
                .thenCompose(failure -> dispatcher.dispatch(new ActionEvent(failedEventType, failure))
                        .handle((ignored, globalError) -> {
                            if (globalError != null) {
                                Throwable cause = unwrap(globalError);
                                log.error("Broadcasting {} for action {} failed", failedEventType, actionType, cause);
                                if (cause != failure.error()) {
                                    failure.error().addSuppressed(cause);
                                }
                            }
                            return failure;
                        }))
                .thenCompose(failure -> CompletableFuture.<Object>failedFuture(new ActionFailedException(failure)));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Tags an error with the phase it came from while it travels down the
     * future chain.
     */
    private static final class PhaseFailure extends RuntimeException {
        private final FailureOrigin origin;

        PhaseFailure(Throwable cause, FailureOrigin origin) {
            super(cause);
            this.origin = origin;
        }
    }
}
