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

package me.golemcore.browser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore Browser API.
 *
 * <p>
 * Exposes browser automation sessions and autonomous agent tasks over HTTP.
 * Every request is routed through a single command dispatcher which owns
 * session resolution, parameter validation and error classification.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → WebFlux controllers (dedicated endpoints + /mcp)
 * Domain Layer       → CommandDispatcher, SessionRegistry, AgentTaskManager
 * Infrastructure     → Playwright browser adapter, langchain4j LLM adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the
 * {@code browser-api.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BrowserApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrowserApiApplication.class, args);
    }

}
