package me.remotepilot.domain.service;

import me.remotepilot.domain.model.HistoryEntry;
import me.remotepilot.domain.model.SessionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionActorRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private ExecutorService executor;
    private SessionService sessionService;
    private SessionActorRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        sessionService = mock(SessionService.class);
        when(sessionService.getOrCreate(anyString()))
                .thenAnswer(invocation -> SessionState.create(invocation.getArgument(0), NOW));
        registry = new SessionActorRegistry(sessionService, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRunTasksForOneSessionOneAtATimeInOrder() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Integer>> futures = new ArrayList<>();

        for (int i = 0; i < 20; i++) {
            int index = i;
            futures.add(registry.submit("main", session -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                sleepQuietly(2);
                order.add(index);
                running.decrementAndGet();
                return index;
            }));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        assertEquals(1, maxRunning.get());
        for (int i = 0; i < 20; i++) {
            assertEquals(i, order.get(i));
        }
    }

    @Test
    void shouldRunDifferentSessionsInParallel() throws Exception {
        CountDownLatch otherStarted = new CountDownLatch(1);

        CompletableFuture<Boolean> waiting = registry.submit("a", session -> awaitQuietly(otherStarted));
        CompletableFuture<Void> other = registry.submit("b", session -> {
            otherStarted.countDown();
            return null;
        });

        other.get(5, TimeUnit.SECONDS);
        assertTrue(waiting.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldSurfaceTaskFailureAndKeepProcessing() {
        CompletableFuture<String> failing = registry.submit("main", session -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = registry.submit("main", session -> "ok");

        CompletionException error = assertThrows(CompletionException.class, failing::join);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("ok", next.join());
    }

    @Test
    void shouldPersistSessionAfterEachTask() {
        registry.submit("main", session -> {
            session.appendHistory(HistoryEntry.user("hi"), NOW);
            return null;
        }).join();
        registry.submit("main", session -> {
            throw new IllegalArgumentException("bad");
        }).exceptionally(error -> null).join();

        verify(sessionService, atLeast(2)).save(any(SessionState.class));
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
