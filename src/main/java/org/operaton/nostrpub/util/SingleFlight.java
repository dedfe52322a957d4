package org.operaton.nostrpub.util;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Collapses concurrent work on the same key into one execution whose result every caller shares.
 * A key is released as soon as its work completes, so later calls start fresh.
 *
 * @param <K> key type
 * @param <V> result type
 */
public class SingleFlight<K, V> {

    private final Map<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    /**
     * Runs the action on the calling thread unless the key is already in flight,
     * in which case the caller blocks for the shared result.
     */
    public V run(K key, Supplier<V> action) {
        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            return join(existing);
        }
        try {
            V value = action.get();
            inFlight.remove(key, mine);
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            inFlight.remove(key, mine);
            mine.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Starts asynchronous work unless the key is already in flight; returns the shared future.
     */
    public CompletableFuture<V> share(K key, Supplier<CompletableFuture<V>> starter) {
        CompletableFuture<V> placeholder = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, placeholder);
        if (existing != null) {
            return existing;
        }
        CompletableFuture<V> started;
        try {
            started = starter.get();
        } catch (RuntimeException e) {
            inFlight.remove(key, placeholder);
            placeholder.completeExceptionally(e);
            return placeholder;
        }
        started.whenComplete((value, error) -> {
            inFlight.remove(key, placeholder);
            if (error != null) {
                placeholder.completeExceptionally(error);
            } else {
                placeholder.complete(value);
            }
        });
        return placeholder;
    }

    public boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }

    public int size() {
        return inFlight.size();
    }

    private V join(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
