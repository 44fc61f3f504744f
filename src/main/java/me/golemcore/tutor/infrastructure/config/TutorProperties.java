package me.golemcore.tutor.infrastructure.config;

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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the tutor, bound from
 * application.yml.
 *
 * <p>
 * All configuration lives under the {@code tutor.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - assistant provider, models and credentials</li>
 * <li>{@link RunProperties} - run polling and tool round limits</li>
 * <li>{@link SessionProperties} - session initialization</li>
 * <li>{@link GuardProperties} - ambiguity guard</li>
 * <li>{@link PersistenceProperties} - retry policy for best-effort saves</li>
 * <li>{@link StorageProperties} - local workspace location</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "tutor")
@Data
public class TutorProperties {

    private LlmProperties llm = new LlmProperties();
    private RunProperties run = new RunProperties();
    private SessionProperties session = new SessionProperties();
    private GuardProperties guard = new GuardProperties();
    private PersistenceProperties persistence = new PersistenceProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private PromptsProperties prompts = new PromptsProperties();

    @Data
    public static class LlmProperties {
        private String provider = "openai-assistants";
        private List<String> models = new ArrayList<>(List.of("gpt-4o", "gpt-4o-mini"));
        private String assistantNamePrefix = "GolemCore Tutor - ";
        private OpenAiProperties openai = new OpenAiProperties();
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class OpenAiProperties {
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
    }

    @Data
    public static class Langchain4jProperties {
        private Map<String, ProviderProperties> providers = new HashMap<>();
        private long timeoutMs = 60000;
        private Double temperature = 0.7;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class RunProperties {
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofSeconds(90);
        private int maxToolRounds = 5;
    }

    @Data
    public static class SessionProperties {
        private Duration initTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class GuardProperties {
        private boolean enabled = true;
        private int minMessageLength = 5;
        private List<String> vaguePatterns = new ArrayList<>(List.of(
                "^(what|how|help|explain|why)\\??$",
                "^help( me)?( please)?[.!?]*$",
                "^(explain|tell me)( this| that| it)?[.!?]*$",
                "^what( is| about)? (this|that|it)\\??$",
                "^how( do i| does it)?\\??$"));
    }

    @Data
    public static class PersistenceProperties {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double backoffFactor = 2.0;
        private double jitter = 0.25;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/tutor";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class PromptsProperties {
        private String instructionsTemplate = "classpath:prompts/tutor-assistant.md";
    }
}
