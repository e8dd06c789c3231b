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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.model.AgentRunRequest;
import me.golemcore.browser.domain.model.AgentRunResult;
import me.golemcore.browser.domain.model.BrowserState;
import me.golemcore.browser.domain.model.InteractiveElement;
import me.golemcore.browser.domain.model.ScrollDirection;
import me.golemcore.browser.domain.model.TabInfo;
import me.golemcore.browser.domain.service.BrowserSessionHandle;
import me.golemcore.browser.port.outbound.AgentExecutionPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Autonomous browsing agent driven by an OpenAI chat model.
 *
 * <p>
 * Each step reads the session state, shows it to the model together with the
 * task and the outcome of previous steps, and applies the single JSON action
 * the model answers with. The run ends when the model answers {@code done},
 * the step budget or the deadline is exhausted, or several steps in a row
 * have failed.
 *
 * <p>
 * All browser access goes through the session handle, so agent commands are
 * queued with any direct commands sent to the same session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jBrowserAgent implements AgentExecutionPort {

    static final int MAX_CONSECUTIVE_FAILURES = 3;

    private static final int MAX_PROMPT_ELEMENTS = 150;
    private static final int MAX_HISTORY_ENTRIES = 20;

    private static final String SYSTEM_PROMPT = """
            You are a browser automation agent. You complete the user's task by issuing one browser \
            action per reply.

            Reply with exactly one JSON object and nothing else. Supported actions:
            {"action": "navigate", "url": "https://...", "new_tab": false}
            {"action": "click", "index": 0, "new_tab": false}
            {"action": "type", "index": 0, "text": "..."}
            {"action": "key", "key": "Enter"}
            {"action": "scroll", "direction": "down"}
            {"action": "back"}
            {"action": "switch_tab", "tab_index": 0}
            {"action": "done", "success": true, "result": "final answer for the user"}

            Element indices refer to the interactive element list of the current step only.
            Use "done" as soon as the task is complete, or with "success": false when it cannot be completed.
            """;

    private final OpenAiChatModelFactory modelFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public AgentRunResult run(AgentRunRequest request, BrowserSessionHandle handle) {
        ChatModel model = modelFactory.getModel(request.getModel());
        List<String> history = new ArrayList<>();
        List<String> urlsVisited = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int consecutiveFailures = 0;
        int steps = 0;

        while (steps < request.getMaxSteps()) {
            if (request.getDeadline() != null && clock.instant().isAfter(request.getDeadline())) {
                errors.add("Deadline reached after " + steps + " steps");
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                errors.add("Agent interrupted after " + steps + " steps");
                break;
            }
            steps++;
            try {
                BrowserState state = handle.getState(request.isUseVision());
                recordUrl(urlsVisited, state.getUrl());

                JsonNode action = parseAction(ask(model, request, state, history));
                String type = action.path("action").asText("");
                if ("done".equals(type)) {
                    boolean success = action.path("success").asBoolean(true);
                    String result = action.path("result").asText("");
                    log.info("[Agent] Task {} finished after {} steps (success: {})", request.getTaskId(), steps,
                            success);
                    if (!success && !result.isBlank()) {
                        errors.add(result);
                    }
                    return AgentRunResult.builder()
                            .successful(success)
                            .finalResult(result)
                            .stepsCompleted(steps)
                            .urlsVisited(urlsVisited)
                            .errors(errors)
                            .build();
                }

                String outcome = apply(type, action, handle);
                history.add("Step " + steps + ": " + type + " -> " + outcome);
                log.debug("[Agent] Task {} step {}: {} -> {}", request.getTaskId(), steps, type, outcome);
                consecutiveFailures = 0;
            } catch (OrchestrationException e) {
                String message = "Step " + steps + ": " + e.getMessage();
                errors.add(message);
                history.add(message + " (failed)");
                log.debug("[Agent] Task {} step {} failed: {}", request.getTaskId(), steps, e.getMessage());
                consecutiveFailures++;
                if (consecutiveFailures >= MAX_CONSECUTIVE_FAILURES) {
                    errors.add("Stopped after " + consecutiveFailures + " consecutive failures");
                    break;
                }
            }
        }

        return AgentRunResult.builder()
                .successful(false)
                .stepsCompleted(steps)
                .urlsVisited(urlsVisited)
                .errors(errors)
                .build();
    }

    @Override
    public boolean isAvailable() {
        return modelFactory.isConfigured();
    }

    private String ask(ChatModel model, AgentRunRequest request, BrowserState state, List<String> history) {
        String prompt = describe(request, state, history);
        UserMessage userMessage = state.getScreenshot() != null
                ? UserMessage.from(TextContent.from(prompt), ImageContent.from(state.getScreenshot(), "image/png"))
                : UserMessage.from(prompt);
        List<ChatMessage> messages = List.of(SystemMessage.from(SYSTEM_PROMPT), userMessage);
        ChatResponse response;
        try {
            response = model.chat(messages);
        } catch (RuntimeException e) {
            throw OrchestrationException.upstream("LLM call failed: " + e.getMessage(), e);
        }
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null || text.isBlank()) {
            throw OrchestrationException.upstream("Model returned an empty reply");
        }
        return text;
    }

    JsonNode parseAction(String reply) {
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw OrchestrationException.upstream("Model reply is not a JSON action: " + abbreviate(reply));
        }
        try {
            JsonNode node = objectMapper.readTree(reply.substring(start, end + 1));
            if (!node.isObject() || !node.hasNonNull("action")) {
                throw OrchestrationException.upstream("Model reply has no action: " + abbreviate(reply));
            }
            return node;
        } catch (JsonProcessingException e) {
            throw OrchestrationException.upstream("Model reply is not valid JSON: " + abbreviate(reply), e);
        }
    }

    private String apply(String type, JsonNode action, BrowserSessionHandle handle) {
        boolean newTab = action.path("new_tab").asBoolean(false);
        switch (type) {
        case "navigate" -> {
            TabInfo tab = handle.navigate(requireText(type, action, "url"), newTab);
            return "loaded " + tab.getUrl();
        }
        case "click" -> {
            int index = requireInt(type, action, "index");
            Optional<TabInfo> opened = handle.click(index, newTab);
            return opened.map(tab -> "opened " + tab.getUrl() + " in tab " + tab.getIndex())
                    .orElse("clicked element " + index);
        }
        case "type" -> {
            int index = requireInt(type, action, "index");
            handle.type(index, requireText(type, action, "text"));
            return "typed into element " + index;
        }
        case "key" -> {
            String key = requireText(type, action, "key");
            handle.pressKey(key);
            return "pressed " + key;
        }
        case "scroll" -> {
            ScrollDirection direction = "up".equalsIgnoreCase(action.path("direction").asText())
                    ? ScrollDirection.UP
                    : ScrollDirection.DOWN;
            handle.scroll(direction);
            return "scrolled " + direction.wireName();
        }
        case "back" -> {
            handle.goBack();
            return "went back";
        }
        case "switch_tab" -> {
            TabInfo tab = handle.switchTab(requireInt(type, action, "tab_index"));
            return "switched to " + tab.getUrl();
        }
        default -> throw OrchestrationException.upstream("Unknown action: " + type);
        }
    }

    private String describe(AgentRunRequest request, BrowserState state, List<String> history) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Task: ").append(request.getDescription()).append("\n\n");

        if (!history.isEmpty()) {
            prompt.append("Previous steps:\n");
            history.subList(Math.max(0, history.size() - MAX_HISTORY_ENTRIES), history.size())
                    .forEach(entry -> prompt.append("- ").append(entry).append('\n'));
            prompt.append('\n');
        }

        prompt.append("Current URL: ").append(state.getUrl()).append('\n');
        prompt.append("Title: ").append(state.getTitle()).append('\n');
        if (state.getTabs() != null && state.getTabs().size() > 1) {
            prompt.append("Tabs:\n");
            for (TabInfo tab : state.getTabs()) {
                prompt.append('[').append(tab.getIndex()).append(']')
                        .append(tab.isActive() ? " (active) " : " ")
                        .append(tab.getTitle()).append(" - ").append(tab.getUrl()).append('\n');
            }
        }

        prompt.append("Interactive elements:\n");
        List<InteractiveElement> elements = state.getInteractiveElements() != null
                ? state.getInteractiveElements()
                : List.of();
        if (elements.isEmpty()) {
            prompt.append("(none)\n");
        }
        elements.stream().limit(MAX_PROMPT_ELEMENTS).forEach(element -> {
            prompt.append('[').append(element.getIndex()).append("] <").append(element.getTag()).append("> ")
                    .append(element.getText());
            if (element.getPlaceholder() != null) {
                prompt.append(" placeholder=\"").append(element.getPlaceholder()).append('"');
            }
            if (element.getHref() != null) {
                prompt.append(" href=").append(element.getHref());
            }
            prompt.append('\n');
        });
        return prompt.toString();
    }

    private static void recordUrl(List<String> urlsVisited, String url) {
        if (url == null || url.isBlank() || "about:blank".equals(url)) {
            return;
        }
        if (urlsVisited.isEmpty() || !urlsVisited.get(urlsVisited.size() - 1).equals(url)) {
            urlsVisited.add(url);
        }
    }

    private static String requireText(String type, JsonNode action, String field) {
        JsonNode value = action.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw OrchestrationException.upstream("Action '" + type + "' requires '" + field + "'");
        }
        return value.asText();
    }

    private static int requireInt(String type, JsonNode action, String field) {
        JsonNode value = action.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw OrchestrationException.upstream("Action '" + type + "' requires integer '" + field + "'");
        }
        return value.asInt();
    }

    private static String abbreviate(String text) {
        String trimmed = text.strip();
        return trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed;
    }
}
