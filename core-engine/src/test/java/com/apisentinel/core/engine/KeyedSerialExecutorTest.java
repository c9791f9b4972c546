package com.apisentinel.core.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Unit tests for {@link KeyedSerialExecutor}. */
class KeyedSerialExecutorTest {

    private KeyedSerialExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new KeyedSerialExecutor(Executors.newFixedThreadPool(4));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("Should run tasks of one key in submission order, one at a time")
    void shouldSerializePerKey() throws Exception {
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (int i = 0; i < 200; i++) {
            int n = i;
            futures.add(executor.submit("/checkout", () -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                order.add(n);
                running.decrementAndGet();
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(order).hasSize(200).isSorted();
        assertThat(maxRunning.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should run different keys in parallel")
    void shouldRunKeysConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        Runnable task = () -> {
            bothStarted.countDown();
            try {
                bothStarted.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        CompletableFuture<Void> a = executor.submit("/a", task);
        CompletableFuture<Void> b = executor.submit("/b", task);
        CompletableFuture.allOf(a, b).get(10, TimeUnit.SECONDS);

        assertThat(bothStarted.getCount()).isZero();
    }

    @Test
    @DisplayName("Should keep running a key's chain after a task fails")
    void shouldContinueAfterFailure() throws Exception {
        List<String> ran = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<Void> failing = executor.submit("/orders", () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<Void> next = executor.submit("/orders", () -> ran.add("next"));
        next.get(5, TimeUnit.SECONDS);

        assertThat(failing).isCompleted().isNotCompletedExceptionally();
        assertThat(ran).containsExactly("next");
    }

    @Test
    @DisplayName("Should forget keys once their tasks are done")
    void shouldReleaseIdleKeys() throws Exception {
        executor.submit("/a", () -> { }).get(5, TimeUnit.SECONDS);
        executor.submit("/b", () -> { }).get(5, TimeUnit.SECONDS);

        long deadline = System.currentTimeMillis() + 5_000;
        while (executor.activeKeys() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(executor.activeKeys()).isZero();
    }

    @Test
    @DisplayName("Should run tasks queued behind a busy key before closing")
    void shouldDrainQueuedTasksOnClose() {
        List<String> ran = Collections.synchronizedList(new ArrayList<>());
        executor.submit("/checkout", () -> {
            sleep(300);
            ran.add("first");
        });
        CompletableFuture<Void> second = executor.submit("/checkout", () -> ran.add("second"));

        executor.close();

        assertThat(ran).containsExactly("first", "second");
        assertThat(second).isCompleted().isNotCompletedExceptionally();
    }

    @Test
    @DisplayName("Should reject tasks submitted after close")
    void shouldRejectAfterClose() {
        executor.close();

        assertThatThrownBy(() -> executor.submit("/checkout", () -> { }))
                .isInstanceOf(RejectedExecutionException.class)
                .hasMessageContaining("/checkout");
    }

    // ---- Helpers ----

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
