package com.bank.recovery.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationTurnExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(8);
    private final ConversationTurnExecutor executor = new ConversationTurnExecutor(pool);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void sameKey_runsOneAtATimeInSubmissionOrder() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());

        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int n = i;
            futures.add(executor.submit("CONV-1", () -> {
                maxConcurrent.accumulateAndGet(running.incrementAndGet(), Math::max);
                sleep(2);
                order.add(n);
                running.decrementAndGet();
                return n;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertThat(maxConcurrent.get()).isEqualTo(1);
        assertThat(order).isSorted().hasSize(20);
    }

    @Test
    void differentKeys_runInParallel() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        CompletableFuture<Boolean> a = executor.submit("CONV-A", () -> awaitLatch(bothStarted));
        CompletableFuture<Boolean> b = executor.submit("CONV-B", () -> awaitLatch(bothStarted));

        assertThat(a.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(b.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void failedTask_doesNotBlockTheNextOne() {
        assertThatThrownBy(() -> executor.execute("CONV-1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(executor.execute("CONV-1", () -> "next")).isEqualTo("next");
    }

    @Test
    void idleKeysAreReleased() {
        executor.execute("CONV-1", () -> 1);
        executor.execute("CONV-2", () -> 2);

        assertThat(executor.pendingKeys()).isZero();
    }

    private static boolean awaitLatch(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
