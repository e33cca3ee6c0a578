package com.nayem.fluxion.core;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for dispatcher throughput and failures.
 * <p>
 * Every meter is tagged with the dispatcher name so several dispatchers can
 * share one registry. A {@code null} registry turns every method into a no-op.
 * </p>
 */
public class DispatcherMetrics {

    private final AtomicInteger queueDepth = new AtomicInteger();
    private final Counter startedCounter;
    private final Counter queuedCounter;
    private final Counter failedDispatchCounter;
    private final Counter failedCallbackCounter;
    private final Counter rejectedWaitForCounter;
    private final Timer dispatchTimer;

    public DispatcherMetrics(MeterRegistry registry, String dispatcherName) {
        if (registry != null) {
            Gauge.builder("fluxion.dispatch.queue.depth", queueDepth, AtomicInteger::get)
                    .description("Broadcasts waiting for the open broadcast to finish")
                    .tag("dispatcher", dispatcherName)
                    .register(registry);

            this.startedCounter = Counter.builder("fluxion.dispatch.started")
                    .description("Number of broadcasts opened")
                    .tag("dispatcher", dispatcherName)
                    .register(registry);

            this.queuedCounter = Counter.builder("fluxion.dispatch.queued")
                    .description("Number of broadcasts deferred because another one was open")
                    .tag("dispatcher", dispatcherName)
                    .register(registry);

            this.failedDispatchCounter = Counter.builder("fluxion.dispatch.failed")
                    .description("Number of broadcasts that completed with a failure")
                    .tag("dispatcher", dispatcherName)
                    .register(registry);

            this.failedCallbackCounter = Counter.builder("fluxion.callback.failed")
                    .description("Number of callback invocations that failed")
                    .tag("dispatcher", dispatcherName)
                    .register(registry);

            this.rejectedWaitForCounter = Counter.builder("fluxion.waitfor.rejected")
                    .description("Number of waitFor calls rejected as programming errors")
                    .tag("dispatcher", dispatcherName)
                    .register(registry);

            this.dispatchTimer = Timer.builder("fluxion.dispatch.duration")
                    .description("Time from opening a broadcast until its last callback settled")
                    .tag("dispatcher", dispatcherName)
                    .register(registry);
        } else {
            this.startedCounter = null;
            this.queuedCounter = null;
            this.failedDispatchCounter = null;
            this.failedCallbackCounter = null;
            this.rejectedWaitForCounter = null;
            this.dispatchTimer = null;
        }
    }

    public void recordStarted() {
        if (startedCounter != null) {
            startedCounter.increment();
        }
    }

    public void recordQueued() {
        if (queuedCounter != null) {
            queuedCounter.increment();
        }
    }

    public void recordFailedDispatch() {
        if (failedDispatchCounter != null) {
            failedDispatchCounter.increment();
        }
    }

    public void recordFailedCallback() {
        if (failedCallbackCounter != null) {
            failedCallbackCounter.increment();
        }
    }

    public void recordRejectedWaitFor() {
        if (rejectedWaitForCounter != null) {
            rejectedWaitForCounter.increment();
        }
    }

    public void recordDuration(long nanos) {
        if (dispatchTimer != null) {
            dispatchTimer.record(nanos, TimeUnit.NANOSECONDS);
        }
    }

    public void updateQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    public static DispatcherMetrics noOp() {
        return new DispatcherMetrics(null, "noop");
    }
}
