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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code pilot.*} prefix:
 * <ul>
 * <li>{@link SecurityProperties} - API secret for bearer authentication</li>
 * <li>{@link AgentProperties} - execution agent endpoint</li>
 * <li>{@link LlmProperties} - completion service provider settings</li>
 * <li>{@link RateLimitProperties} - per-session fixed window</li>
 * <li>{@link SessionProperties} - session defaults</li>
 * <li>{@link ConfirmationProperties} - tools that need a yes/no reply</li>
 * <li>{@link SchedulerProperties} - trigger pool and time zone</li>
 * <li>{@link StorageProperties} - local state directory</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "pilot")
@Data
public class PilotProperties {

    private SecurityProperties security = new SecurityProperties();
    private AgentProperties agent = new AgentProperties();
    private LlmProperties llm = new LlmProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private SessionProperties session = new SessionProperties();
    private ConfirmationProperties confirmation = new ConfirmationProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class SecurityProperties {
        private String apiSecret = "";
    }

    @Data
    public static class AgentProperties {
        private String url = "http://localhost:3847";
        private String authToken = "";
        private int timeoutSeconds = 30;
    }

    @Data
    public static class LlmProperties {
        private String provider = "anthropic";
        private String model = "claude-sonnet-4-20250514";
        private String visionModel = "";
        private int maxTokens = 4096;
        private long timeoutMs = 120000;
        private String assistantName = "SYSTEM";
        private ProviderProperties anthropic = new ProviderProperties();
        private ProviderProperties openai = new ProviderProperties();
        private ProviderProperties custom = new ProviderProperties();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int maxRequests = 60;
        private int windowSeconds = 60;
    }

    @Data
    public static class SessionProperties {
        private String defaultId = "main";
        private int promptHistory = 40;
    }

    @Data
    public static class ConfirmationProperties {
        private List<String> sensitiveTools = new ArrayList<>(List.of(
                "send_imessage", "finder_trash", "sleep_mac"));
    }

    @Data
    public static class SchedulerProperties {
        private int poolSize = 2;
        private String zone = "";
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.remote-pilot/state";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
