package com.bank.recovery.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Runs work one task at a time per key and in parallel across keys.
 *
 * Each key keeps a reference to its most recently submitted task; a new task is chained
 * after it and runs on the shared pool once it finishes, whatever its outcome. The entry is
 * dropped when the last task of a key completes, so idle keys hold no memory.
 */
@Component
public class ConversationTurnExecutor {

    private static final Logger log = LoggerFactory.getLogger(ConversationTurnExecutor.class);

    private final ExecutorService turnExecutor;
    private final ConcurrentHashMap<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    public ConversationTurnExecutor(@Qualifier("turnExecutor") ExecutorService turnExecutor) {
        this.turnExecutor = turnExecutor;
    }

    /**
     * Queue {@code task} behind every earlier task submitted for {@code key}.
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> submit(String key, Supplier<T> task) {
        CompletableFuture<T> next = (CompletableFuture<T>) tails.compute(key, (k, previous) -> {
            CompletableFuture<?> base = previous == null ? CompletableFuture.completedFuture(null) : previous;
            return base.handle((ignored, error) -> null)
                    .thenApplyAsync(ignored -> task.get(), turnExecutor);
        });
        // Callers observe completion only after the key has been released
        return next.whenComplete((result, error) -> tails.remove(key, next));
    }

    /**
     * Submit and wait for the result. A runtime exception thrown by the task is rethrown as is.
     */
    public <T> T execute(String key, Supplier<T> task) {
        try {
            return submit(key, task).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            log.error("Serialized task for {} failed: {}", key, cause.getMessage(), cause);
            throw e;
        }
    }

    int pendingKeys() {
        return tails.size();
    }
}
