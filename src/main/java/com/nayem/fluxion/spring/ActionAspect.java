package com.nayem.fluxion.spring;

import com.nayem.fluxion.action.ActionFailedException;
import com.nayem.fluxion.action.ActionRunner;
import com.nayem.fluxion.action.FailureOrigin;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Aspect
public class ActionAspect {

    private final ActionRunner runner;
    private final Duration blockTimeout;

    public ActionAspect(ActionRunner runner, Duration blockTimeout) {
        this.runner = runner;
        this.blockTimeout = blockTimeout;
    }

    @Around(value = "@annotation(action)", argNames = "action")
    public Object handleAction(ProceedingJoinPoint joinPoint, Action action) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String actionType = action.value().isEmpty()
                ? signature.getDeclaringType().getSimpleName() + "." + signature.getName()
                : action.value();

        CompletableFuture<Object> outcome = runner.run(actionType, joinPoint.getArgs(), joinPoint::proceed);

        if (CompletionStage.class.isAssignableFrom(signature.getReturnType())) {
            return outcome;
        }

        try {
            return outcome.get(blockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            // The caller of a blocking action sees its own exception, not the wrapper.
            if (cause instanceof ActionFailedException failed
                    && failed.getFailure().origin() == FailureOrigin.ACTION) {
                throw failed.getFailure().error();
            }
            throw cause;
        } catch (TimeoutException e) {
            throw new IllegalStateException(
                    "Action " + actionType + " did not complete within " + blockTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for action " + actionType, e);
        }
    }
}
