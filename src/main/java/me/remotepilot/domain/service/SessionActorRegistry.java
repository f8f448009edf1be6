package me.remotepilot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.SessionState;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Runs work against a session one task at a time.
 *
 * <p>
 * Every session id gets a {@link SessionActor} with a FIFO mailbox drained on
 * the shared {@code sessionRunExecutor}. At most one task per session runs at
 * any moment; tasks for different sessions run in parallel. Every task sees
 * the session's current state and the session is persisted after each task,
 * whether the task succeeded or not.
 *
 * <p>
 * Chat requests, WebSocket messages and schedule triggers all go through
 * {@link #submit}, so a trigger firing during a live message is queued behind
 * it.
 */
@Service
@Slf4j
public class SessionActorRegistry {

    private final SessionService sessionService;
    private final ExecutorService sessionRunExecutor;

    private final Map<String, SessionActor> actors = new ConcurrentHashMap<>();

    public SessionActorRegistry(SessionService sessionService,
            @Qualifier("sessionRunExecutor") ExecutorService sessionRunExecutor) {
        this.sessionService = sessionService;
        this.sessionRunExecutor = sessionRunExecutor;
    }

    /**
     * Queue {@code work} on the session's mailbox.
     *
     * @return future completed with the work's result, or exceptionally with
     *         the exception it threw
     */
    public <T> CompletableFuture<T> submit(String sessionId, Function<SessionState, T> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        SessionActor actor = actors.computeIfAbsent(sessionId, SessionActor::new);
        actor.enqueue(() -> {
            SessionState session = sessionService.getOrCreate(sessionId);
            try {
                result.complete(work.apply(session));
            } catch (RuntimeException e) { // NOSONAR - surfaced through the future
                result.completeExceptionally(e);
            } finally {
                sessionService.save(session);
            }
        });
        return result;
    }

    private final class SessionActor {

        private final String sessionId;
        private final Object lock = new Object();
        private final Deque<Runnable> mailbox = new ArrayDeque<>();

        private boolean running;

        private SessionActor(String sessionId) {
            this.sessionId = sessionId;
        }

        void enqueue(Runnable task) {
            synchronized (lock) {
                if (running) {
                    mailbox.addLast(task);
                    return;
                }
                running = true;
            }
            startRun(task);
        }

        private void startRun(Runnable task) {
            try {
                sessionRunExecutor.execute(() -> {
                    try {
                        task.run();
                    } catch (Exception e) { // NOSONAR - must not kill executor thread
                        log.error("[Session] task failed: sessionId={}: {}", sessionId, e.getMessage(), e);
                    } finally {
                        onRunComplete();
                    }
                });
            } catch (RejectedExecutionException e) {
                synchronized (lock) {
                    running = false;
                    mailbox.clear();
                }
                log.warn("[Session] executor rejected task: sessionId={}", sessionId);
                throw e;
            }
        }

        private void onRunComplete() {
            Runnable next;
            synchronized (lock) {
                next = mailbox.pollFirst();
                if (next == null) {
                    running = false;
                    return;
                }
            }
            startRun(next);
        }
    }
}
