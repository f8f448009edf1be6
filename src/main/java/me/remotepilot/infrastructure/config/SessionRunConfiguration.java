package me.remotepilot.infrastructure.config;

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

import jakarta.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for session actors, outbound calls and schedule triggers.
 *
 * <p>
 * Session mailboxes are drained on {@code session-run} daemon threads. Blocking
 * calls to the execution agent and the completion service run on
 * {@code outbound-io} threads, so a slow call only holds up its own session.
 * Triggers only hand work over to a session mailbox, so the scheduler pool
 * stays small.
 */
@Configuration
public class SessionRunConfiguration {

    private ExecutorService executor;
    private ExecutorService outboundExecutor;

    @Bean(name = "sessionRunExecutor")
    public ExecutorService sessionRunExecutor() {
        executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "session-run");
            thread.setDaemon(true);
            return thread;
        });
        return executor;
    }

    @Bean(name = "outboundIoExecutor")
    public ExecutorService outboundIoExecutor() {
        outboundExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "outbound-io");
            thread.setDaemon(true);
            return thread;
        });
        return outboundExecutor;
    }

    @Bean
    public TaskScheduler taskScheduler(PilotProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.getScheduler().getPoolSize()));
        scheduler.setThreadNamePrefix("schedule-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @PreDestroy
    public void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
        if (outboundExecutor != null) {
            outboundExecutor.shutdownNow();
        }
    }
}
