package me.golemcore.persona.infrastructure.config;

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration for the responder, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * <li>{@link AccessProperties} - admins, whitelists and blacklists</li>
 * <li>{@link SessionProperties} - history bound and accepted kinds</li>
 * <li>{@link PromptsProperties} - prompt file locations</li>
 * <li>{@link LlmProperties} - remote endpoint, timeout and retries</li>
 * <li>{@link ModelHyperparameters} - pass-through sampling parameters</li>
 * </ul>
 *
 * <p>
 * These values seed the runtime snapshot built by {@link ResponderConfigService};
 * components never read them directly at request time.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private AccessProperties access = new AccessProperties();
    private SessionProperties session = new SessionProperties();
    private PromptsProperties prompts = new PromptsProperties();
    private LlmProperties llm = new LlmProperties();
    private ModelHyperparameters modelHyperparameters = new ModelHyperparameters();
    private PersonaProperties persona = new PersonaProperties();
    private DispatcherProperties dispatcher = new DispatcherProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/persona";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== ACCESS ====================

    @Data
    public static class AccessProperties {
        private List<Long> adminIds = new ArrayList<>();
        private AccessListProperties group = new AccessListProperties(true);
        private AccessListProperties user = new AccessListProperties(false);
    }

    @Data
    public static class AccessListProperties {
        private boolean enableWhitelist;
        private List<Long> whitelist = new ArrayList<>();
        private List<Long> blacklist = new ArrayList<>();

        public AccessListProperties() {
        }

        public AccessListProperties(boolean enableWhitelist) {
            this.enableWhitelist = enableWhitelist;
        }
    }

    // ==================== SESSIONS ====================

    @Data
    public static class SessionProperties {
        private List<String> validMessageTypes = new ArrayList<>(List.of("text"));
        private int maxHistory = 10;
        private Duration mergeWindow = Duration.ZERO;
    }

    // ==================== PROMPTS ====================

    @Data
    public static class PromptsProperties {
        private String systemGroup = "system/group.yaml";
        private String systemPrivate = "system/private.yaml";
        private String character = "character/default.yaml";
        private boolean writeDefaults = true;
        private boolean auditQueries = true;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String apiUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        private String model;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 2;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class ModelHyperparameters {
        private Double temperature = 0.7;
        private Integer maxTokens = 2048;
        private Long seed;
        private Double topP;
        private Integer topK;
        private Double frequencyPenalty;
        private Double presencePenalty;
        private Double repetitionPenalty;
        private Double minP;
        private Double topA;
    }

    // ==================== RUNTIME ====================

    @Data
    public static class PersonaProperties {
        private String language = "en";
    }

    @Data
    public static class DispatcherProperties {
        private int threads = 4;
        private int maxQueuedPerConversation = 100;
    }
}
