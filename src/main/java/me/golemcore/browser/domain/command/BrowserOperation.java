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

package me.golemcore.browser.domain.command;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static me.golemcore.browser.domain.command.ParameterSpec.oneOf;
import static me.golemcore.browser.domain.command.ParameterSpec.optionalBoolean;
import static me.golemcore.browser.domain.command.ParameterSpec.optionalInteger;
import static me.golemcore.browser.domain.command.ParameterSpec.optionalNumber;
import static me.golemcore.browser.domain.command.ParameterSpec.optionalString;
import static me.golemcore.browser.domain.command.ParameterSpec.requiredIndex;
import static me.golemcore.browser.domain.command.ParameterSpec.requiredString;
import static me.golemcore.browser.domain.command.ParameterSpec.requiredText;
import static me.golemcore.browser.domain.command.ParameterSpec.stringList;

/**
 * Closed set of operations accepted by the
 * {@link me.golemcore.browser.domain.service.CommandDispatcher}.
 *
 * <p>
 * Each constant carries its wire name, routing class and parameter schema.
 * Lookup by name goes through a static table built once, so an unknown name
 * is rejected before anything else happens.
 */
public enum BrowserOperation {

    CREATE_SESSION("create_browser_session", OperationClass.SESSION_LIFECYCLE,
            "Create a new browser session",
            optionalString(Params.SESSION_ID, null, "Custom session ID (generated when omitted)"),
            optionalBoolean(Params.HEADLESS, true, "Whether to run the browser in headless mode"),
            stringList(Params.ALLOWED_DOMAINS, "Domains navigation is restricted to (empty allows all)"),
            optionalNumber(Params.WAIT_BETWEEN_ACTIONS, 0.5, 0, "Seconds to wait after each action"),
            optionalString(Params.USER_DATA_DIR, null, "Browser profile directory to persist state in")),

    LIST_SESSIONS("list_browser_sessions", OperationClass.SESSION_LIFECYCLE,
            "List all active browser sessions"),

    CLOSE_SESSION("close_browser_session", OperationClass.SESSION_LIFECYCLE,
            "Close a browser session and release its browser",
            requiredString(Params.SESSION_ID, "ID of the session to close")),

    NAVIGATE("browser_navigate", OperationClass.BROWSER_CONTROL,
            "Navigate to a URL in the active tab or a new tab",
            requiredString(Params.URL, "The URL to navigate to"),
            optionalBoolean(Params.NEW_TAB, false, "Whether to open the URL in a new tab"),
            sessionIdParam()),

    CLICK("browser_click", OperationClass.BROWSER_CONTROL,
            "Click an interactive element by index",
            requiredIndex(Params.INDEX, "Index of the element to click"),
            optionalBoolean(Params.NEW_TAB, false, "Whether to open a link target in a new tab"),
            sessionIdParam()),

    TYPE("browser_type", OperationClass.BROWSER_CONTROL,
            "Type text into an input element",
            requiredIndex(Params.INDEX, "Index of the input element"),
            requiredText(Params.TEXT, "The text to type"),
            sessionIdParam()),

    PRESS_KEY("browser_key", OperationClass.BROWSER_CONTROL,
            "Press a keyboard key, e.g. Enter, Escape, F5 or Control+A",
            requiredString(Params.KEY, "Key or key combination to press"),
            sessionIdParam()),

    SCROLL("browser_scroll", OperationClass.BROWSER_CONTROL,
            "Scroll the page by one viewport",
            oneOf(Params.DIRECTION, "down", List.of("up", "down"), "Direction to scroll"),
            sessionIdParam()),

    GO_BACK("browser_go_back", OperationClass.BROWSER_CONTROL,
            "Go back in browser history",
            sessionIdParam()),

    GET_STATE("browser_get_state", OperationClass.BROWSER_CONTROL,
            "Get the current page state with indexed interactive elements",
            optionalBoolean(Params.INCLUDE_SCREENSHOT, false, "Whether to include a base64 PNG screenshot"),
            sessionIdParam()),

    LIST_TABS("browser_list_tabs", OperationClass.BROWSER_CONTROL,
            "List all open tabs",
            sessionIdParam()),

    SWITCH_TAB("browser_switch_tab", OperationClass.BROWSER_CONTROL,
            "Switch to a tab by index",
            requiredIndex(Params.TAB_INDEX, "Index of the tab to switch to"),
            sessionIdParam()),

    CLOSE_TAB("browser_close_tab", OperationClass.BROWSER_CONTROL,
            "Close a tab by index",
            requiredIndex(Params.TAB_INDEX, "Index of the tab to close"),
            sessionIdParam()),

    EXTRACT_CONTENT("browser_extract_content", OperationClass.EXTRACTION,
            "Extract information from the current page using an LLM",
            requiredString(Params.QUERY, "What information to extract from the page"),
            optionalBoolean(Params.EXTRACT_LINKS, false, "Whether to include links in the extraction"),
            sessionIdParam()),

    RUN_AGENT_TASK("run_agent_task", OperationClass.AGENT_TASK,
            "Run an autonomous agent task against a session in the background",
            requiredString(Params.TASK, "The task description for the agent"),
            optionalInteger(Params.MAX_STEPS, 100, 1, "Maximum number of steps the agent can take"),
            optionalString(Params.MODEL, "gpt-4o", "LLM model to use"),
            stringList(Params.ALLOWED_DOMAINS, "Ignored for shared sessions; the session allow-list applies"),
            optionalBoolean(Params.USE_VISION, true, "Whether to use vision capabilities"),
            sessionIdParam()),

    RETRY_WITH_AGENT("retry_with_browser_use_agent", OperationClass.AGENT_TASK,
            "Run an autonomous agent task in its own private browser session",
            requiredString(Params.TASK, "The task description for the agent"),
            optionalInteger(Params.MAX_STEPS, 100, 1, "Maximum number of steps the agent can take"),
            optionalString(Params.MODEL, "gpt-4o", "LLM model to use"),
            stringList(Params.ALLOWED_DOMAINS, "Domains the private session may navigate to"),
            optionalBoolean(Params.USE_VISION, true, "Whether to use vision capabilities"),
            optionalBoolean(Params.HEADLESS, true, "Whether the private browser runs headless")),

    GET_TASK_STATUS("get_agent_task_status", OperationClass.AGENT_TASK,
            "Get the status of an agent task",
            requiredString(Params.TASK_ID, "ID returned when the task was submitted")),

    LIST_TASKS("list_agent_tasks", OperationClass.AGENT_TASK,
            "List known agent tasks");

    private static final Map<String, BrowserOperation> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(BrowserOperation::getName, Function.identity()));

    private final String name;
    private final OperationClass operationClass;
    private final String description;
    private final List<ParameterSpec> parameters;

    BrowserOperation(String name, OperationClass operationClass, String description, ParameterSpec... parameters) {
        this.name = name;
        this.operationClass = operationClass;
        this.description = description;
        this.parameters = List.of(parameters);
    }

    public static Optional<BrowserOperation> fromName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name.trim()));
    }

    public String getName() {
        return name;
    }

    public OperationClass getOperationClass() {
        return operationClass;
    }

    public String getDescription() {
        return description;
    }

    public List<ParameterSpec> getParameters() {
        return parameters;
    }

    /**
     * Whether the operation drives the browser of a session resolved from
     * {@code session_id}, defaulting to the lazily created default session.
     */
    public boolean drivesSession() {
        return operationClass == OperationClass.BROWSER_CONTROL || operationClass == OperationClass.EXTRACTION;
    }

    public OperationDefinition toDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = parameters.stream()
                .filter(ParameterSpec::required)
                .map(ParameterSpec::name)
                .toList();
        for (ParameterSpec spec : parameters) {
            properties.put(spec.name(), spec.toSchema());
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Collections.unmodifiableMap(properties));
        schema.put("required", required);
        return OperationDefinition.builder()
                .name(name)
                .description(description)
                .operationClass(operationClass)
                .inputSchema(schema)
                .build();
    }

    private static ParameterSpec sessionIdParam() {
        return optionalString(Params.SESSION_ID, SessionIds.DEFAULT, "Browser session ID");
    }

    /**
     * Parameter wire names.
     */
    public static final class Params {
        public static final String SESSION_ID = "session_id";
        public static final String HEADLESS = "headless";
        public static final String ALLOWED_DOMAINS = "allowed_domains";
        public static final String WAIT_BETWEEN_ACTIONS = "wait_between_actions";
        public static final String USER_DATA_DIR = "user_data_dir";
        public static final String URL = "url";
        public static final String NEW_TAB = "new_tab";
        public static final String INDEX = "index";
        public static final String TEXT = "text";
        public static final String KEY = "key";
        public static final String DIRECTION = "direction";
        public static final String INCLUDE_SCREENSHOT = "include_screenshot";
        public static final String TAB_INDEX = "tab_index";
        public static final String QUERY = "query";
        public static final String EXTRACT_LINKS = "extract_links";
        public static final String TASK = "task";
        public static final String MAX_STEPS = "max_steps";
        public static final String MODEL = "model";
        public static final String USE_VISION = "use_vision";
        public static final String TASK_ID = "task_id";

        private Params() {
        }
    }

    private static final class SessionIds {
        private static final String DEFAULT = "default";
    }
}
