package me.remotepilot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Remote Pilot.
 *
 * <p>
 * Remote Pilot turns natural-language chat messages into automation actions
 * executed on a remote device by an external execution agent.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Session orchestrator</b> - one serialized actor per user session
 * driving completion, parsing and tool execution</li>
 * <li><b>Confirm before execute</b> - sensitive actions wait for an explicit
 * yes/no reply</li>
 * <li><b>Scheduling</b> - one-time and recurring tasks parsed from natural
 * language or cron syntax, durably tracked per session</li>
 * <li><b>Real-time fan-out</b> - scheduled results pushed to every connected
 * WebSocket listener</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → ChatController, ScheduleController, RealtimeWebSocketHandler
 * Domain Layer       → SessionOrchestrator, ScheduleService, PendingActionStateMachine
 * Infrastructure     → Execution agent / completion / storage adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code pilot.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RemotePilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemotePilotApplication.class, args);
    }

}
