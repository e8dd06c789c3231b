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
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.model.AllowedDomains;
import me.golemcore.browser.domain.model.BrowserPage;
import me.golemcore.browser.domain.model.BrowserState;
import me.golemcore.browser.domain.model.InteractiveElement;
import me.golemcore.browser.domain.model.ScrollDirection;
import me.golemcore.browser.domain.model.TabInfo;
import me.golemcore.browser.port.outbound.BrowserControlPort;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Exclusive wrapper around the {@link BrowserControlPort} of one session.
 *
 * <p>
 * The underlying browser context does not accept concurrent commands, so
 * every call is queued on a single-thread executor owned by this handle and
 * runs in arrival order. Callers block until their command has run or the
 * operation timeout has passed; a timed-out command is not cancelled and
 * later commands still queue behind it.
 *
 * <p>
 * Index-based operations read the live element or tab list inside the same
 * queued command that acts on it, so an index is validated against the state
 * it is applied to. A stale index fails with NOT_FOUND and changes nothing.
 */
@Slf4j
public class BrowserSessionHandle {

    private static final long MILLIS_PER_SECOND = 1000L;
    private static final List<String> HTTP_SCHEMES = List.of("http://", "https://");

    private final String sessionId;
    private final BrowserControlPort port;
    private final AllowedDomains allowedDomains;
    private final Duration waitBetweenActions;
    private final Duration operationTimeout;
    private final ExecutorService commandExecutor;

    private volatile boolean closed = false;

    public BrowserSessionHandle(String sessionId, BrowserControlPort port, AllowedDomains allowedDomains,
            Duration waitBetweenActions, Duration operationTimeout) {
        this.sessionId = sessionId;
        this.port = port;
        this.allowedDomains = allowedDomains != null ? allowedDomains : AllowedDomains.unrestricted();
        this.waitBetweenActions = waitBetweenActions != null ? waitBetweenActions : Duration.ZERO;
        this.operationTimeout = operationTimeout;
        this.commandExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "browser-session-" + sessionId);
            t.setDaemon(true);
            return t;
        });
    }

    public String getSessionId() {
        return sessionId;
    }

    public AllowedDomains getAllowedDomains() {
        return allowedDomains;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Navigate the active tab, or open a new tab and switch to it.
     *
     * @return the tab the page was loaded in
     */
    public TabInfo navigate(String url, boolean newTab) {
        String target = normalizeUrl(url);
        requirePermitted(target);
        return execute("navigate", () -> {
            TabInfo tab = newTab ? port.openTab(target) : port.navigate(target);
            pauseBetweenActions();
            return tab;
        });
    }

    /**
     * Click the element at {@code index}. With {@code newTab}, links are opened
     * in a new tab which becomes active.
     *
     * @return the newly opened tab, if the click opened one by link target
     */
    public Optional<TabInfo> click(int index, boolean newTab) {
        return execute("click", () -> {
            InteractiveElement element = requireElement(port.interactiveElements(), index);
            String href = element.getHref();
            if (newTab && isHttpUrl(href)) {
                requirePermitted(href);
                TabInfo opened = port.openTab(href);
                pauseBetweenActions();
                return Optional.of(opened);
            }
            port.click(index, newTab);
            pauseBetweenActions();
            return Optional.<TabInfo>empty();
        });
    }

    public void type(int index, String text) {
        execute("type", () -> {
            requireElement(port.interactiveElements(), index);
            port.type(index, text);
            pauseBetweenActions();
            return null;
        });
    }

    public void pressKey(String key) {
        execute("key", () -> {
            port.pressKey(key);
            pauseBetweenActions();
            return null;
        });
    }

    public int scroll(ScrollDirection direction) {
        return execute("scroll", () -> {
            int distance = port.scroll(direction);
            pauseBetweenActions();
            return distance;
        });
    }

    public void goBack() {
        execute("go_back", () -> {
            port.goBack();
            pauseBetweenActions();
            return null;
        });
    }

    public BrowserState getState(boolean includeScreenshot) {
        return execute("get_state", () -> port.state(includeScreenshot));
    }

    public BrowserPage readPage() {
        return execute("read_page", port::readPage);
    }

    public List<InteractiveElement> interactiveElements() {
        return execute("interactive_elements", port::interactiveElements);
    }

    public List<TabInfo> listTabs() {
        return execute("list_tabs", port::tabs);
    }

    public int tabCount() {
        return execute("tab_count", () -> port.tabs().size());
    }

    public TabInfo switchTab(int index) {
        return execute("switch_tab", () -> {
            requireTab(port.tabs(), index);
            return port.switchTab(index);
        });
    }

    public TabInfo closeTab(int index) {
        return execute("close_tab", () -> {
            requireTab(port.tabs(), index);
            return port.closeTab(index);
        });
    }

    /**
     * Stop accepting commands, let already queued commands finish and release
     * the browser. Release failures are logged, never thrown.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        try {
            commandExecutor.submit(this::releasePort);
        } catch (RejectedExecutionException e) {
            log.warn("[Session {}] Release could not be queued: {}", sessionId, e.getMessage());
        }
        commandExecutor.shutdown();
        try {
            if (!commandExecutor.awaitTermination(operationTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Session {}] Browser release did not finish within {} ms, abandoning command thread",
                        sessionId, operationTimeout.toMillis());
                commandExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            commandExecutor.shutdownNow();
        }
    }

    private void releasePort() {
        try {
            port.close();
            log.debug("[Session {}] Browser released", sessionId);
        } catch (RuntimeException e) {
            log.warn("[Session {}] Failed to release browser: {}", sessionId, e.getMessage(), e);
        }
    }

    private <T> T execute(String operation, Callable<T> command) {
        if (closed) {
            throw closedError();
        }
        Future<T> future;
        try {
            future = commandExecutor.submit(command);
        } catch (RejectedExecutionException e) {
            throw closedError();
        }
        try {
            return future.get(operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Session {}] {} did not finish within {} ms", sessionId, operation,
                    operationTimeout.toMillis());
            throw OrchestrationException.timeout("Operation " + operation + " on session " + sessionId
                    + " timed out after " + operationTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            OrchestrationException failure = OrchestrationException.classify(e.getCause());
            log.debug("[Session {}] {} failed: {}", sessionId, operation, failure.getMessage());
            throw failure;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OrchestrationException.upstream("Interrupted while waiting for " + operation);
        }
    }

    private InteractiveElement requireElement(List<InteractiveElement> elements, int index) {
        if (index < 0 || index >= elements.size()) {
            throw OrchestrationException.notFound("Element with index " + index + " not found");
        }
        return elements.get(index);
    }

    private void requireTab(List<TabInfo> tabs, int index) {
        if (index < 0 || index >= tabs.size()) {
            throw OrchestrationException.notFound("Tab with index " + index + " not found");
        }
    }

    private void requirePermitted(String url) {
        if (!allowedDomains.permits(url)) {
            throw OrchestrationException.domainNotAllowed(
                    "Navigation to " + url + " is not allowed for session " + sessionId);
        }
    }

    private void pauseBetweenActions() throws InterruptedException {
        if (!waitBetweenActions.isZero() && !waitBetweenActions.isNegative()) {
            Thread.sleep(waitBetweenActions.toMillis());
        }
    }

    private OrchestrationException closedError() {
        return OrchestrationException.notFound("Session " + sessionId + " is closed");
    }

    private static boolean isHttpUrl(String url) {
        return url != null && httpScheme(url.toLowerCase(Locale.ROOT)).isPresent();
    }

    private static Optional<String> httpScheme(String lowerCaseUrl) {
        return HTTP_SCHEMES.stream().filter(lowerCaseUrl::startsWith).findFirst();
    }

    /**
     * Only http and https are accepted, in any letter case; the scheme is
     * returned lower-cased and a bare host gets {@code https://}.
     */
    static String normalizeUrl(String url) {
        if (url == null || url.isBlank()) {
            throw OrchestrationException.invalidParameters("url is required");
        }
        String trimmed = url.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        Optional<String> scheme = httpScheme(lower);
        if (scheme.isPresent()) {
            return scheme.get() + trimmed.substring(scheme.get().length());
        }
        if (lower.contains("://") || lower.startsWith("javascript:") || lower.startsWith("data:")
                || lower.startsWith("file:")) {
            throw OrchestrationException.invalidParameters("Only http and https URLs are allowed");
        }
        return "https://" + trimmed;
    }

    static Duration secondsToDuration(double seconds) {
        if (seconds <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(Math.round(seconds * MILLIS_PER_SECOND));
    }
}
