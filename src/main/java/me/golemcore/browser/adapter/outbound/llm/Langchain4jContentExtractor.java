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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.model.BrowserPage;
import me.golemcore.browser.domain.model.ExtractionResult;
import me.golemcore.browser.infrastructure.config.BrowserApiProperties;
import me.golemcore.browser.port.outbound.ContentExtractionPort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Answers an extraction query over the visible text of a page with an OpenAI
 * chat model.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jContentExtractor implements ContentExtractionPort {

    private static final String SYSTEM_PROMPT = """
            You extract information from web pages.
            Answer the query using only the page content provided.
            If the information is not on the page, say so explicitly.
            Respond with the extracted content only, without commentary.
            """;

    private static final int MAX_LINKS = 200;

    private final OpenAiChatModelFactory modelFactory;
    private final BrowserApiProperties properties;

    @Override
    public ExtractionResult extract(String query, boolean extractLinks, BrowserPage page) {
        ChatModel model = modelFactory.getModel(properties.getLlm().getExtractionModel());
        List<ChatMessage> messages = List.of(
                SystemMessage.from(SYSTEM_PROMPT),
                UserMessage.from(buildPrompt(query, extractLinks, page)));

        log.debug("[Extraction] Query '{}' on {}", query, page.getUrl());
        ChatResponse response;
        try {
            response = model.chat(messages);
        } catch (RuntimeException e) {
            throw OrchestrationException.upstream("Content extraction failed: " + e.getMessage(), e);
        }
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null || text.isBlank()) {
            throw OrchestrationException.upstream("Content extraction returned no content");
        }
        return ExtractionResult.builder()
                .content(text.trim())
                .build();
    }

    @Override
    public boolean isAvailable() {
        return modelFactory.isConfigured();
    }

    String buildPrompt(String query, boolean extractLinks, BrowserPage page) {
        int maxChars = properties.getLlm().getMaxPageChars();
        String text = page.getText() != null ? page.getText() : "";
        if (text.length() > maxChars) {
            text = text.substring(0, maxChars) + "\n[content truncated]";
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("Query: ").append(query).append("\n\n");
        prompt.append("Page URL: ").append(page.getUrl()).append('\n');
        prompt.append("Page title: ").append(page.getTitle()).append("\n\n");
        prompt.append("Page content:\n").append(text).append('\n');
        if (extractLinks && page.getLinks() != null && !page.getLinks().isEmpty()) {
            prompt.append("\nLinks on the page:\n");
            page.getLinks().stream()
                    .limit(MAX_LINKS)
                    .forEach(link -> prompt.append("- ").append(link).append('\n'));
        }
        return prompt.toString();
    }
}
