package com.triagedesk.support.common.concurrent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Collapses overlapping calls with the same key into one execution. Callers arriving while a call is in
 * flight block until it finishes and receive its result (or its exception).
 */
public class SingleFlight<T> {

    private final ConcurrentMap<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();

    public T run(String key, Supplier<T> work) {
        var mine = new CompletableFuture<T>();
        var existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            return await(existing);
        }

        try {
            T result = work.get();
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    private T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error err) throw err;
            throw e;
        }
    }
}
