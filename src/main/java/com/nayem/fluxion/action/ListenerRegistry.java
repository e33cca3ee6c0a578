package com.nayem.fluxion.action;

import com.nayem.fluxion.core.DispatchToken;
import com.nayem.fluxion.core.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Subscribes {@link FluxionListener}s to a dispatcher and remembers their
 * tokens by listener type, so one listener can wait for another:
 *
 * <pre>{@code
 * public CompletionStage<?> onEvent(ActionEvent event) {
 *     return registry.waitFor(CartStore.class).thenRun(() -> recompute(event));
 * }
 * }</pre>
 */
public class ListenerRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ListenerRegistry.class);

    private final Dispatcher<ActionEvent> dispatcher;
    private final Map<Class<?>, List<DispatchToken>> tokens = new LinkedHashMap<>();

    public ListenerRegistry(Dispatcher<ActionEvent> dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Subscribes a listener. Several listeners of the same type may be
     * registered; each keeps its own subscription.
     */
    public synchronized DispatchToken register(FluxionListener listener) {
        DispatchToken token = dispatcher.register(
                event -> listener.accepts(event.actionType()) ? listener.onEvent(event) : null);
        List<DispatchToken> sameType = tokens.computeIfAbsent(listener.getClass(), type -> new ArrayList<>());
        sameType.add(token);
        if (sameType.size() > 1) {
            log.debug("Listener type {} now has {} registrations", listener.getClass().getName(), sameType.size());
        }
        return token;
    }

    /**
     * Unsubscribes every listener of the given type or one of its subtypes.
     */
    public synchronized void unregister(Class<?> listenerType) {
        Iterator<Map.Entry<Class<?>, List<DispatchToken>>> entries = tokens.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<Class<?>, List<DispatchToken>> entry = entries.next();
            if (listenerType.isAssignableFrom(entry.getKey())) {
                entry.getValue().forEach(dispatcher::unregister);
                entries.remove();
            }
        }
    }

    /**
     * Finds the token of a listener by its type. Subclasses (such as Spring
     * proxies) of the requested type match too; an exact type match wins.
     *
     * @throws IllegalStateException if more than one listener matches
     */
    public synchronized Optional<DispatchToken> tokenFor(Class<?> listenerType) {
        List<DispatchToken> matches = tokens.get(listenerType);
        if (matches == null) {
            matches = tokens.entrySet().stream()
                    .filter(entry -> listenerType.isAssignableFrom(entry.getKey()))
                    .flatMap(entry -> entry.getValue().stream())
                    .collect(Collectors.toList());
        }
        if (matches.size() > 1) {
            throw new IllegalStateException("Listener type " + listenerType.getName()
                    + " is ambiguous, " + matches.size() + " listeners match: " + matches);
        }
        return matches.stream().findFirst();
    }

    /**
     * Waits for the given listeners within the open broadcast.
     */
    public CompletableFuture<Void> waitFor(Class<?>... listenerTypes) {
        List<DispatchToken> required = new ArrayList<>(listenerTypes.length);
        for (Class<?> type : listenerTypes) {
            Optional<DispatchToken> token;
            try {
                token = tokenFor(type);
            } catch (IllegalStateException e) {
                return CompletableFuture.failedFuture(e);
            }
            if (token.isEmpty()) {
                return CompletableFuture.failedFuture(
                        new IllegalArgumentException("No listener registered for type: " + type.getName()));
            }
            required.add(token.get());
        }
        return dispatcher.waitFor(required);
    }

    public synchronized int size() {
        return tokens.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public synchronized void close() {
        log.info("ListenerRegistry shutting down, unregistering {} listeners...", size());
        tokens.values().forEach(sameType -> sameType.forEach(dispatcher::unregister));
        tokens.clear();
    }
}
