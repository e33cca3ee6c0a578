package com.nayem.fluxion.core;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link Dispatcher} that runs one broadcast at a time and callbacks one at a
 * time.
 * <p>
 * Callbacks run in registration order. Each callback must settle before the
 * next one starts, even when it is asynchronous. A callback may call
 * {@link #waitFor(Collection)} to pull other callbacks of the same broadcast
 * ahead of itself; asking for a callback that is still executing is rejected
 * as a circular dependency.
 * </p>
 * <p>
 * Broadcasts requested while one is open are queued and drained FIFO. The
 * registration map, the queue, the open broadcast and the dispatching flag are
 * guarded by a single lock which is never held while user code runs.
 * </p>
 * <p>
 * There is no timeout: a callback that never settles stalls the dispatcher and
 * everything queued behind it.
 * </p>
 *
 * @param <P> the payload type
 */
public class SequentialDispatcher<P> implements Dispatcher<P> {

    private static final Logger log = LoggerFactory.getLogger(SequentialDispatcher.class);

    public static final String DEFAULT_TOKEN_PREFIX = "ID_";

    private static final AtomicLong LAST_ID = new AtomicLong();

    private final String tokenPrefix;
    private final DispatcherMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<DispatchToken, DispatchCallback<P>> callbacks = new LinkedHashMap<>();
    private final Deque<Broadcast<P>> queue = new ArrayDeque<>();
    private Broadcast<P> current;
    private volatile boolean dispatching;

    public SequentialDispatcher() {
        this(DEFAULT_TOKEN_PREFIX, DispatcherMetrics.noOp());
    }

    public SequentialDispatcher(String tokenPrefix, DispatcherMetrics metrics) {
        Objects.requireNonNull(tokenPrefix, "tokenPrefix");
        if (tokenPrefix.isBlank()) {
            throw new IllegalArgumentException("Token prefix must not be blank.");
        }
        this.tokenPrefix = tokenPrefix;
        this.metrics = metrics != null ? metrics : DispatcherMetrics.noOp();
    }

    @Override
    public DispatchToken register(DispatchCallback<P> callback) {
        Objects.requireNonNull(callback, "callback");
        DispatchToken token = new DispatchToken(tokenPrefix + LAST_ID.incrementAndGet());

        lock.lock();
        try {
            callbacks.put(token, callback);
        } finally {
            lock.unlock();
        }

        log.debug("Registered callback {}", token);
        return token;
    }

    @Override
    public void unregister(DispatchToken token) {
        boolean removed;
        lock.lock();
        try {
            removed = callbacks.remove(token) != null;
        } finally {
            lock.unlock();
        }

        if (removed) {
            log.debug("Unregistered callback {}", token);
        }
    }

    @Override
    public boolean isDispatching() {
        return dispatching;
    }

    /**
     * Returns the callback most recently started in the open broadcast, if any.
     */
    public Optional<DispatchToken> dispatchingToken() {
        lock.lock();
        try {
            return current != null ? Optional.ofNullable(current.dispatchingToken()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public int registeredCount() {
        lock.lock();
        try {
            return callbacks.size();
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CompletableFuture<Void> dispatch(P payload) {
        Broadcast<P> broadcast = new Broadcast<>(payload);

        lock.lock();
        try {
            if (dispatching) {
                queue.addLast(broadcast);
                metrics.recordQueued();
                metrics.updateQueueDepth(queue.size());
                log.debug("Broadcast already in progress, queued payload (queue depth {})", queue.size());
                return broadcast.outcome();
            }
            open(broadcast);
        } finally {
            lock.unlock();
        }

        drainFrom(broadcast);
        return broadcast.outcome();
    }

    @Override
    public CompletableFuture<Void> waitFor(Collection<DispatchToken> tokens) {
        Broadcast<P> broadcast;
        List<DispatchToken> batch;

        lock.lock();
        try {
            if (!dispatching || current == null) {
                metrics.recordRejectedWaitFor();
                return CompletableFuture.failedFuture(new NotDispatchingException());
            }
            broadcast = current;

            Set<DispatchToken> requested = new HashSet<>();
            for (DispatchToken token : tokens) {
                if (!callbacks.containsKey(token)) {
                    metrics.recordRejectedWaitFor();
                    return CompletableFuture.failedFuture(new UnknownCallbackException(token));
                }
                if (broadcast.isOpen(token)) {
                    metrics.recordRejectedWaitFor();
                    return CompletableFuture.failedFuture(new CircularDependencyException(token));
                }
                if (broadcast.isPending(token)) {
                    requested.add(token);
                }
            }
            batch = broadcast.pendingAmong(requested);
        } finally {
            lock.unlock();
        }

        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        log.trace("waitFor pulling {} ahead", batch);
        return runBatch(broadcast, batch);
    }

    // Caller holds the lock.
    private void open(Broadcast<P> broadcast) {
        dispatching = true;
        current = broadcast;
        broadcast.begin(callbacks.keySet());
        metrics.recordStarted();
        log.debug("Opened broadcast for {} callbacks", broadcast.pendingCount());
    }

    /**
     * Runs the given broadcast and then every broadcast handed off to it by
     * {@link #close(Broadcast, Throwable)}. Synchronous broadcasts are drained
     * in a loop; an asynchronous one resumes the loop from its completion.
     */
    private void drainFrom(Broadcast<P> first) {
        Broadcast<P> next = first;
        while (next != null) {
            Broadcast<P> broadcast = next;
            CompletableFuture<Void> batch = runBatch(broadcast, broadcast.pendingSnapshot());
            if (!batch.isDone()) {
                batch.whenComplete((ignored, error) -> drainFrom(close(broadcast, unwrap(error))));
                return;
            }
            next = close(broadcast, failureOf(batch));
        }
    }

    /**
     * Settles a finished broadcast. If another broadcast is queued it is opened
     * before the flag could be observed as cleared, and returned so the caller
     * runs it next.
     */
    private Broadcast<P> close(Broadcast<P> broadcast, Throwable failure) {
        Broadcast<P> next;
        lock.lock();
        try {
            broadcast.clearDispatchingToken();
            next = queue.pollFirst();
            if (next != null) {
                metrics.updateQueueDepth(queue.size());
                open(next);
            } else {
                current = null;
                dispatching = false;
            }
        } finally {
            lock.unlock();
        }

        metrics.recordDuration(broadcast.elapsedNanos());
        if (failure == null) {
            log.debug("Broadcast completed");
            broadcast.outcome().complete(null);
        } else {
            metrics.recordFailedDispatch();
            log.debug("Broadcast completed with failure: {}", failure.toString());
            broadcast.outcome().completeExceptionally(failure);
        }
        return next;
    }

    private CompletableFuture<Void> runBatch(Broadcast<P> broadcast, List<DispatchToken> tokens) {
        CompletableFuture<Void> settled = new CompletableFuture<>();
        advance(broadcast, tokens.iterator(), new AtomicReference<>(), settled);
        return settled;
    }

    /**
     * Steps through the batch until it is exhausted or a callback is still
     * running, in which case stepping resumes when that callback settles.
     */
    private void advance(Broadcast<P> broadcast, Iterator<DispatchToken> tokens,
            AtomicReference<Throwable> firstFailure, CompletableFuture<Void> settled) {
        while (tokens.hasNext()) {
            DispatchToken token = tokens.next();
            CompletableFuture<Void> job = runJob(broadcast, token);
            if (!job.isDone()) {
                job.whenComplete((ignored, error) -> {
                    firstFailure.compareAndSet(null, unwrap(error));
                    advance(broadcast, tokens, firstFailure, settled);
                });
                return;
            }
            firstFailure.compareAndSet(null, failureOf(job));
        }

        lock.lock();
        try {
            broadcast.clearDispatchingToken();
        } finally {
            lock.unlock();
        }

        Throwable failure = firstFailure.get();
        if (failure == null) {
            settled.complete(null);
        } else {
            settled.completeExceptionally(failure);
        }
    }

    private CompletableFuture<Void> runJob(Broadcast<P> broadcast, DispatchToken token) {
        DispatchCallback<P> callback;
        lock.lock();
        try {
            broadcast.enter(token);
            callback = broadcast.isPending(token) ? callbacks.get(token) : null;
        } finally {
            lock.unlock();
        }

        CompletableFuture<Void> invocation = callback != null
                ? invoke(callback, broadcast.payload())
                : CompletableFuture.completedFuture(null);

        CompletableFuture<Void> job = new CompletableFuture<>();
        invocation.whenComplete((ignored, error) -> {
            lock.lock();
            try {
                broadcast.exit(token);
            } finally {
                lock.unlock();
            }

            if (error == null) {
                job.complete(null);
            } else {
                Throwable cause = unwrap(error);
                metrics.recordFailedCallback();
                log.warn("Callback {} failed: {}", token, cause.toString());
                job.completeExceptionally(cause);
            }
        });
        return job;
    }

    private CompletableFuture<Void> invoke(DispatchCallback<P> callback, P payload) {
        try {
            CompletionStage<?> stage = callback.onDispatch(payload);
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> result = new CompletableFuture<>();
            stage.whenComplete((value, error) -> {
                if (error == null) {
                    result.complete(null);
                } else {
                    result.completeExceptionally(unwrap(error));
                }
            });
            return result;
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private static Throwable failureOf(CompletableFuture<?> done) {
        if (!done.isCompletedExceptionally()) {
            return null;
        }
        try {
            done.join();
            return null;
        } catch (CompletionException | CancellationException e) {
            return unwrap(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    public static <P> Builder<P> builder() {
        return new Builder<>();
    }

    /**
     * Builder for {@link SequentialDispatcher}.
     *
     * @param <P> the payload type
     */
    public static class Builder<P> {
        private String tokenPrefix = DEFAULT_TOKEN_PREFIX;
        private MeterRegistry registry;
        private String name = "default";
        private DispatcherMetrics metrics;

        /**
         * Sets the prefix of generated tokens. Default is {@code ID_}.
         */
        public Builder<P> tokenPrefix(String tokenPrefix) {
            this.tokenPrefix = tokenPrefix;
            return this;
        }

        /**
         * Sets the name used to tag this dispatcher's meters.
         */
        public Builder<P> name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Sets the Micrometer registry for recording metrics.
         */
        public Builder<P> metrics(MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Uses an already built metrics holder; takes precedence over
         * {@link #metrics(MeterRegistry)}.
         */
        public Builder<P> metrics(DispatcherMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public SequentialDispatcher<P> build() {
            if (tokenPrefix == null || tokenPrefix.isBlank()) {
                throw new IllegalStateException("Token prefix must not be blank.");
            }
            DispatcherMetrics resolved = metrics != null ? metrics : new DispatcherMetrics(registry, name);
            return new SequentialDispatcher<>(tokenPrefix, resolved);
        }
    }
}
