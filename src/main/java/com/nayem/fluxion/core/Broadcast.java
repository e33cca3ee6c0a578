package com.nayem.fluxion.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Bookkeeping for one dispatch cycle.
 * <p>
 * A broadcast holds the payload, the callbacks that have not run yet (the
 * pending set, in registration order) and the callbacks currently executing
 * (the open set). The same instance is handed to the top-level batch and to
 * every nested {@code waitFor} batch, so a callback consumed by a nested batch
 * is skipped when the top-level loop reaches it.
 * </p>
 * <p>
 * Not thread-safe on its own: {@link SequentialDispatcher} mutates it only
 * while holding its lock.
 * </p>
 *
 * @param <P> the payload type
 */
final class Broadcast<P> {

    private final P payload;
    private final CompletableFuture<Void> outcome = new CompletableFuture<>();
    private final Set<DispatchToken> pending = new LinkedHashSet<>();
    private final Set<DispatchToken> open = new LinkedHashSet<>();
    private DispatchToken dispatchingToken;
    private long startedAt;

    Broadcast(P payload) {
        this.payload = payload;
    }

    /**
     * Resets the open set and snapshots the registration order as pending.
     */
    void begin(Collection<DispatchToken> registered) {
        open.clear();
        pending.clear();
        pending.addAll(registered);
        startedAt = System.nanoTime();
    }

    void enter(DispatchToken token) {
        dispatchingToken = token;
        open.add(token);
    }

    void exit(DispatchToken token) {
        if (token == null) {
            return;
        }
        pending.remove(token);
        open.remove(token);
    }

    boolean isPending(DispatchToken token) {
        return pending.contains(token);
    }

    boolean isOpen(DispatchToken token) {
        return open.contains(token);
    }

    /**
     * Returns the pending tokens, restricted to {@code requested} and in
     * registration order.
     */
    List<DispatchToken> pendingAmong(Set<DispatchToken> requested) {
        List<DispatchToken> ordered = new ArrayList<>(requested.size());
        for (DispatchToken token : pending) {
            if (requested.contains(token)) {
                ordered.add(token);
            }
        }
        return ordered;
    }

    List<DispatchToken> pendingSnapshot() {
        return new ArrayList<>(pending);
    }

    void clearDispatchingToken() {
        dispatchingToken = null;
    }

    DispatchToken dispatchingToken() {
        return dispatchingToken;
    }

    int openCount() {
        return open.size();
    }

    int pendingCount() {
        return pending.size();
    }

    P payload() {
        return payload;
    }

    CompletableFuture<Void> outcome() {
        return outcome;
    }

    long elapsedNanos() {
        return System.nanoTime() - startedAt;
    }
}
