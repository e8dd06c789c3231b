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

package me.golemcore.browser.adapter.outbound.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.infrastructure.config.BrowserApiProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds and caches langchain4j OpenAI chat models, one per model name, from
 * the {@code browser-api.llm.*} settings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiChatModelFactory {

    private static final int MAX_RETRIES = 2;

    private final BrowserApiProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public boolean isConfigured() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * @throws OrchestrationException
     *             UPSTREAM_FAILURE when no API key is configured
     */
    public ChatModel getModel(String modelName) {
        if (!isConfigured()) {
            throw OrchestrationException.upstream("OPENAI_API_KEY not set in config or environment");
        }
        String name = modelName == null || modelName.isBlank()
                ? properties.getLlm().getExtractionModel()
                : modelName.trim();
        return models.computeIfAbsent(name, this::createModel);
    }

    private ChatModel createModel(String modelName) {
        BrowserApiProperties.LlmProperties llm = properties.getLlm();
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(modelName)
                .maxRetries(MAX_RETRIES)
                .timeout(llm.getTimeout());

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (supportsTemperature(modelName)) {
            builder.temperature(llm.getTemperature());
        }
        log.info("[LLM] Created OpenAI chat model {}", modelName);
        return builder.build();
    }

    private static boolean supportsTemperature(String modelName) {
        String name = modelName.toLowerCase(Locale.ROOT);
        return !(name.startsWith("o1") || name.startsWith("o3") || name.startsWith("o4") || name.startsWith("gpt-5"));
    }
}
