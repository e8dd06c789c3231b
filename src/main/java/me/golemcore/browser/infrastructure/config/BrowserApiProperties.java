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

package me.golemcore.browser.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties, bound from application.yml.
 *
 * <p>
 * All configuration is organized under the {@code browser-api.*} prefix:
 * <ul>
 * <li>{@link SessionProperties} - defaults and limits for browser sessions</li>
 * <li>{@link TaskProperties} - agent task execution and retention</li>
 * <li>{@link BrowserProperties} - Playwright launch settings</li>
 * <li>{@link LlmProperties} - OpenAI credentials and model settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "browser-api")
@Data
public class BrowserApiProperties {

    private SessionProperties sessions = new SessionProperties();
    private TaskProperties tasks = new TaskProperties();
    private BrowserProperties browser = new BrowserProperties();
    private LlmProperties llm = new LlmProperties();

    @Data
    public static class SessionProperties {
        private boolean defaultHeadless = true;
        private double defaultWaitBetweenActions = 0.5;
        private Duration operationTimeout = Duration.ofSeconds(60);
        /**
         * Sessions idle longer than this are closed. Zero disables eviction.
         */
        private Duration idleTtl = Duration.ofMinutes(30);
        private Duration evictionInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class TaskProperties {
        private Duration timeout = Duration.ofMinutes(30);
        /**
         * How long terminal task records stay queryable.
         */
        private Duration retention = Duration.ofHours(1);
        private Duration evictionInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class BrowserProperties {
        private Duration navigationTimeout = Duration.ofSeconds(30);
        private String userAgent;
        private int viewportWidth = 1280;
        private int viewportHeight = 1100;
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private double temperature = 0.7;
        private Duration timeout = Duration.ofSeconds(120);
        private String extractionModel = "gpt-4o";
        private int maxPageChars = 20_000;
    }
}
