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

package me.golemcore.browser.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.command.BrowserOperation;
import me.golemcore.browser.domain.command.BrowserOperation.Params;
import me.golemcore.browser.domain.command.CommandParameters;
import me.golemcore.browser.domain.command.OperationDefinition;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.model.AgentTaskOptions;
import me.golemcore.browser.domain.model.AgentTaskSnapshot;
import me.golemcore.browser.domain.model.BrowserPage;
import me.golemcore.browser.domain.model.BrowserSession;
import me.golemcore.browser.domain.model.ExtractionResult;
import me.golemcore.browser.domain.model.ScrollDirection;
import me.golemcore.browser.domain.model.SessionConfig;
import me.golemcore.browser.domain.model.TabInfo;
import me.golemcore.browser.port.outbound.ContentExtractionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for every operation, whether it arrives through a
 * dedicated HTTP endpoint or the generic tool endpoint.
 *
 * <p>
 * An invocation is looked up by name and its parameters are validated before
 * any session is resolved or any browser is touched. Browser operations then
 * run against the session named by {@code session_id} (the default session
 * when omitted) and mark it active on success.
 */
@Service
@Slf4j
public class CommandDispatcher {

    private static final String LOG_PREFIX = "[Dispatcher]";

    private final SessionRegistry sessionRegistry;
    private final AgentTaskManager agentTaskManager;
    private final ContentExtractionPort contentExtractionPort;
    private final Clock clock;

    private final Map<BrowserOperation, OperationHandler> handlers = new EnumMap<>(BrowserOperation.class);

    public CommandDispatcher(SessionRegistry sessionRegistry, AgentTaskManager agentTaskManager,
            ContentExtractionPort contentExtractionPort, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.agentTaskManager = agentTaskManager;
        this.contentExtractionPort = contentExtractionPort;
        this.clock = clock;
        registerHandlers();
    }

    /**
     * Invoke the operation called {@code operationName}.
     *
     * @return a JSON-serializable result
     * @throws OrchestrationException
     *             UNKNOWN_OPERATION for unknown names, INVALID_PARAMETERS for
     *             bad parameters, or whatever the operation itself raises
     */
    public Object invoke(String operationName, Map<String, ?> parameters) {
        BrowserOperation operation = BrowserOperation.fromName(operationName)
                .orElseThrow(() -> OrchestrationException.unknownOperation(operationName));
        CommandParameters params = CommandParameters.validate(operation, parameters);
        log.debug("{} Invoking {}", LOG_PREFIX, operation.getName());

        OperationHandler handler = handlers.get(operation);
        if (!operation.drivesSession()) {
            return handler.handle(params, null);
        }
        BrowserSession session = sessionRegistry.resolve(params.getString(Params.SESSION_ID));
        Object result = handler.handle(params, session);
        session.touch(clock.instant());
        return result;
    }

    public List<OperationDefinition> listOperations() {
        return Arrays.stream(BrowserOperation.values())
                .map(BrowserOperation::toDefinition)
                .toList();
    }

    private void registerHandlers() {
        handlers.put(BrowserOperation.CREATE_SESSION, (params, session) -> createSession(params));
        handlers.put(BrowserOperation.LIST_SESSIONS,
                (params, session) -> Map.of("sessions", sessionRegistry.list()));
        handlers.put(BrowserOperation.CLOSE_SESSION, (params, session) -> closeSession(params));

        handlers.put(BrowserOperation.NAVIGATE, this::navigate);
        handlers.put(BrowserOperation.CLICK, this::click);
        handlers.put(BrowserOperation.TYPE, (params, session) -> {
            int index = params.getInt(Params.INDEX);
            String text = params.getString(Params.TEXT);
            session.getHandle().type(index, text);
            return message("Typed '" + text + "' into element " + index);
        });
        handlers.put(BrowserOperation.PRESS_KEY, (params, session) -> {
            String key = params.getString(Params.KEY);
            session.getHandle().pressKey(key);
            return message("Pressed key: " + key);
        });
        handlers.put(BrowserOperation.SCROLL, (params, session) -> {
            ScrollDirection direction = ScrollDirection.fromWireName(params.getString(Params.DIRECTION));
            session.getHandle().scroll(direction);
            return message("Scrolled " + direction.wireName());
        });
        handlers.put(BrowserOperation.GO_BACK, (params, session) -> {
            session.getHandle().goBack();
            return message("Navigated back");
        });
        handlers.put(BrowserOperation.GET_STATE,
                (params, session) -> session.getHandle().getState(params.getBoolean(Params.INCLUDE_SCREENSHOT)));
        handlers.put(BrowserOperation.LIST_TABS,
                (params, session) -> Map.of("tabs", session.getHandle().listTabs()));
        handlers.put(BrowserOperation.SWITCH_TAB, (params, session) -> {
            int index = params.getInt(Params.TAB_INDEX);
            TabInfo tab = session.getHandle().switchTab(index);
            return message("Switched to tab " + index + ": " + tab.getUrl());
        });
        handlers.put(BrowserOperation.CLOSE_TAB, (params, session) -> {
            int index = params.getInt(Params.TAB_INDEX);
            TabInfo tab = session.getHandle().closeTab(index);
            return message("Closed tab " + index + ": " + tab.getUrl());
        });

        handlers.put(BrowserOperation.EXTRACT_CONTENT, this::extractContent);

        handlers.put(BrowserOperation.RUN_AGENT_TASK, (params, session) -> runAgentTask(params));
        handlers.put(BrowserOperation.RETRY_WITH_AGENT, (params, session) -> retryWithAgent(params));
        handlers.put(BrowserOperation.GET_TASK_STATUS,
                (params, session) -> agentTaskManager.getStatus(params.getString(Params.TASK_ID)));
        handlers.put(BrowserOperation.LIST_TASKS, (params, session) -> Map.of("tasks", agentTaskManager.list()));
    }

    private Object createSession(CommandParameters params) {
        SessionConfig config = SessionConfig.builder()
                .headless(params.getBoolean(Params.HEADLESS))
                .allowedDomains(new ArrayList<>(params.getStringList(Params.ALLOWED_DOMAINS)))
                .waitBetweenActions(params.getDouble(Params.WAIT_BETWEEN_ACTIONS))
                .userDataDir(params.getString(Params.USER_DATA_DIR))
                .build();
        BrowserSession session = sessionRegistry.create(params.getString(Params.SESSION_ID), config);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("session_id", session.getId());
        result.put("status", session.getStatus().wireName());
        result.put("config", session.getConfig());
        return result;
    }

    private Object closeSession(CommandParameters params) {
        String sessionId = params.getString(Params.SESSION_ID).trim();
        sessionRegistry.close(sessionId);
        return message("Session " + sessionId + " closed successfully");
    }

    private Object navigate(CommandParameters params, BrowserSession session) {
        String url = params.getString(Params.URL);
        boolean newTab = params.getBoolean(Params.NEW_TAB);
        TabInfo tab = session.getHandle().navigate(url, newTab);
        if (newTab) {
            return message("Opened new tab #" + tab.getIndex() + " with URL: " + tab.getUrl());
        }
        return message("Navigated to: " + tab.getUrl());
    }

    private Object click(CommandParameters params, BrowserSession session) {
        int index = params.getInt(Params.INDEX);
        boolean newTab = params.getBoolean(Params.NEW_TAB);
        Optional<TabInfo> opened = session.getHandle().click(index, newTab);
        if (opened.isPresent()) {
            return message("Clicked element " + index + " and opened in new tab #" + opened.get().getIndex());
        }
        if (newTab) {
            return message("Clicked element " + index + " with modifier key (new tab if supported)");
        }
        return message("Clicked element " + index);
    }

    private Object extractContent(CommandParameters params, BrowserSession session) {
        if (!contentExtractionPort.isAvailable()) {
            throw OrchestrationException.upstream("Content extraction is unavailable: OPENAI_API_KEY is not set");
        }
        BrowserPage page = session.getHandle().readPage();
        ExtractionResult extraction;
        try {
            extraction = contentExtractionPort.extract(params.getString(Params.QUERY),
                    params.getBoolean(Params.EXTRACT_LINKS), page);
        } catch (RuntimeException e) {
            throw OrchestrationException.classify(e);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("content", extraction.getContent());
        return result;
    }

    private Object runAgentTask(CommandParameters params) {
        AgentTaskOptions options = AgentTaskOptions.builder()
                .allowedDomains(new ArrayList<>(params.getStringList(Params.ALLOWED_DOMAINS)))
                .useVision(params.getBoolean(Params.USE_VISION))
                .build();
        String taskId = agentTaskManager.submit(params.getString(Params.TASK), params.getString(Params.SESSION_ID),
                params.getInt(Params.MAX_STEPS), params.getString(Params.MODEL), options);
        return taskAccepted(taskId);
    }

    private Object retryWithAgent(CommandParameters params) {
        AgentTaskOptions options = AgentTaskOptions.builder()
                .allowedDomains(new ArrayList<>(params.getStringList(Params.ALLOWED_DOMAINS)))
                .useVision(params.getBoolean(Params.USE_VISION))
                .headless(params.getBoolean(Params.HEADLESS))
                .build();
        String taskId = agentTaskManager.submitWithEphemeralSession(params.getString(Params.TASK),
                params.getInt(Params.MAX_STEPS), params.getString(Params.MODEL), options);
        return taskAccepted(taskId);
    }

    private Map<String, Object> taskAccepted(String taskId) {
        AgentTaskSnapshot snapshot = agentTaskManager.getStatus(taskId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("task_id", taskId);
        result.put("status", snapshot.getStatus());
        result.put("message", "Agent task " + taskId + " started");
        result.put("session_id", snapshot.getSessionId());
        return result;
    }

    private static Map<String, Object> message(String text) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", text);
        return result;
    }

    @FunctionalInterface
    private interface OperationHandler {
        Object handle(CommandParameters params, BrowserSession session);
    }
}
