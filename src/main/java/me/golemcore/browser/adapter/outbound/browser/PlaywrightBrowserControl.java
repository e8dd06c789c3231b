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

package me.golemcore.browser.adapter.outbound.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.KeyboardModifier;
import com.microsoft.playwright.options.LoadState;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.BrowserPage;
import me.golemcore.browser.domain.model.BrowserState;
import me.golemcore.browser.domain.model.InteractiveElement;
import me.golemcore.browser.domain.model.ScrollDirection;
import me.golemcore.browser.domain.model.TabInfo;
import me.golemcore.browser.port.outbound.BrowserControlPort;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Playwright implementation of {@link BrowserControlPort} for one session.
 *
 * <p>
 * Owns a dedicated {@link Playwright} instance, its browser (absent for
 * persistent profiles) and one {@link BrowserContext}; tabs are the pages of
 * that context in creation order. Playwright objects are not thread-safe,
 * which is fine here because every call arrives through the session's single
 * command thread.
 *
 * <p>
 * Interactive elements are indexed by a script that stamps a
 * {@code data-golem-index} attribute on each visible element, so a later
 * click or type locates the element by that attribute.
 */
@Slf4j
public class PlaywrightBrowserControl implements BrowserControlPort {

    static final String INDEX_ATTRIBUTE = "data-golem-index";

    private static final int MAX_ELEMENT_TEXT = 100;

    private static final String INDEX_ELEMENTS_SCRIPT = """
            (() => {
                document.querySelectorAll('[data-golem-index]')
                    .forEach(el => el.removeAttribute('data-golem-index'));
                const selector = 'a[href], button, input:not([type=hidden]), textarea, select, '
                    + '[role=button], [role=link], [role=checkbox], [role=tab], [onclick], [contenteditable=true]';
                const visible = el => {
                    const rect = el.getBoundingClientRect();
                    const style = window.getComputedStyle(el);
                    return rect.width > 0 && rect.height > 0
                        && style.visibility !== 'hidden' && style.display !== 'none';
                };
                const result = [];
                document.querySelectorAll(selector).forEach(el => {
                    if (!visible(el)) {
                        return;
                    }
                    const index = result.length;
                    el.setAttribute('data-golem-index', String(index));
                    const text = (el.innerText || el.value || el.getAttribute('aria-label') || '').trim();
                    result.push({
                        index: index,
                        tag: el.tagName.toLowerCase(),
                        text: text.replace(/\\s+/g, ' '),
                        placeholder: el.getAttribute('placeholder'),
                        href: el.tagName === 'A' ? el.href : null
                    });
                });
                return result;
            })()
            """;

    private static final String TEXT_SCRIPT = """
            (() => {
                const clone = document.body.cloneNode(true);
                const scripts = clone.querySelectorAll('script, style, noscript');
                scripts.forEach(el => el.remove());
                return clone.innerText;
            })()
            """;

    private static final String LINKS_SCRIPT = """
            (() => Array.from(new Set(Array.from(document.querySelectorAll('a[href]'))
                .map(a => a.href)
                .filter(href => href.startsWith('http')))))()
            """;

    private static final String SCROLL_SCRIPT = """
            (direction) => {
                const distance = window.innerHeight * direction;
                window.scrollBy(0, distance);
                return distance;
            }
            """;

    private final String sessionId;
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final double navigationTimeoutMs;

    private Page activePage;

    public PlaywrightBrowserControl(String sessionId, Playwright playwright, Browser browser, BrowserContext context,
            double navigationTimeoutMs) {
        this.sessionId = sessionId;
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.navigationTimeoutMs = navigationTimeoutMs;
        List<Page> pages = context.pages();
        this.activePage = pages.isEmpty() ? newPage() : pages.get(0);
    }

    @Override
    public TabInfo navigate(String url) {
        Page page = activePage();
        page.navigate(url);
        page.waitForLoadState(LoadState.DOMCONTENTLOADED);
        return toTabInfo(page, context.pages().indexOf(page));
    }

    @Override
    public TabInfo openTab(String url) {
        Page page = newPage();
        page.navigate(url);
        page.waitForLoadState(LoadState.DOMCONTENTLOADED);
        activePage = page;
        return toTabInfo(page, context.pages().indexOf(page));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<InteractiveElement> interactiveElements() {
        Object raw = activePage().evaluate(INDEX_ELEMENTS_SCRIPT);
        List<InteractiveElement> elements = new ArrayList<>();
        if (!(raw instanceof List<?>)) {
            return elements;
        }
        for (Object item : (List<Object>) raw) {
            Map<String, Object> entry = (Map<String, Object>) item;
            elements.add(InteractiveElement.builder()
                    .index(((Number) entry.get("index")).intValue())
                    .tag((String) entry.get("tag"))
                    .text(truncate((String) entry.get("text")))
                    .placeholder(blankToNull((String) entry.get("placeholder")))
                    .href(blankToNull((String) entry.get("href")))
                    .build());
        }
        return elements;
    }

    @Override
    public void click(int index, boolean newTab) {
        Locator element = locate(index);
        if (newTab) {
            element.click(new Locator.ClickOptions().setModifiers(List.of(KeyboardModifier.CONTROLORMETA)));
        } else {
            element.click();
        }
    }

    @Override
    public void type(int index, String text) {
        locate(index).fill(text);
    }

    @Override
    public void pressKey(String key) {
        activePage().keyboard().press(key);
    }

    @Override
    public int scroll(ScrollDirection direction) {
        int sign = direction == ScrollDirection.UP ? -1 : 1;
        Object distance = activePage().evaluate(SCROLL_SCRIPT, sign);
        return distance instanceof Number number ? Math.abs(number.intValue()) : 0;
    }

    @Override
    public void goBack() {
        activePage().goBack();
    }

    @Override
    public BrowserState state(boolean includeScreenshot) {
        Page page = activePage();
        BrowserState.BrowserStateBuilder state = BrowserState.builder()
                .url(page.url())
                .title(safeTitle(page))
                .tabs(tabs())
                .interactiveElements(interactiveElements());
        if (includeScreenshot) {
            state.screenshot(Base64.getEncoder().encodeToString(page.screenshot()));
        }
        return state.build();
    }

    @Override
    @SuppressWarnings("unchecked")
    public BrowserPage readPage() {
        Page page = activePage();
        Object links = page.evaluate(LINKS_SCRIPT);
        return BrowserPage.builder()
                .url(page.url())
                .title(safeTitle(page))
                .html(page.content())
                .text(extractText(page))
                .links(links instanceof List<?> ? (List<String>) links : List.of())
                .build();
    }

    @Override
    public List<TabInfo> tabs() {
        List<Page> pages = context.pages();
        List<TabInfo> tabs = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            tabs.add(toTabInfo(pages.get(i), i));
        }
        return tabs;
    }

    @Override
    public TabInfo switchTab(int index) {
        Page page = context.pages().get(index);
        page.bringToFront();
        activePage = page;
        return toTabInfo(page, index);
    }

    @Override
    public TabInfo closeTab(int index) {
        Page page = context.pages().get(index);
        TabInfo closed = toTabInfo(page, index);
        page.close();
        if (page == activePage) {
            List<Page> remaining = context.pages();
            activePage = remaining.isEmpty() ? newPage() : remaining.get(remaining.size() - 1);
        }
        return closed;
    }

    @Override
    public void close() {
        RuntimeException failure = null;
        try {
            context.close();
        } catch (RuntimeException e) {
            failure = e;
        }
        try {
            if (browser != null) {
                browser.close();
            }
        } catch (RuntimeException e) {
            failure = failure != null ? failure : e;
        }
        try {
            playwright.close();
        } catch (RuntimeException e) {
            failure = failure != null ? failure : e;
        }
        if (failure != null) {
            throw failure;
        }
        log.debug("[Playwright] Released browser of session {}", sessionId);
    }

    private Page activePage() {
        if (activePage == null || activePage.isClosed()) {
            List<Page> pages = context.pages();
            activePage = pages.isEmpty() ? newPage() : pages.get(pages.size() - 1);
        }
        return activePage;
    }

    private Page newPage() {
        Page page = context.newPage();
        page.setDefaultNavigationTimeout(navigationTimeoutMs);
        page.setDefaultTimeout(navigationTimeoutMs);
        return page;
    }

    private Locator locate(int index) {
        return activePage().locator("[" + INDEX_ATTRIBUTE + "=\"" + index + "\"]").first();
    }

    private TabInfo toTabInfo(Page page, int index) {
        return TabInfo.builder()
                .index(index)
                .url(page.url())
                .title(safeTitle(page))
                .active(page == activePage)
                .build();
    }

    private String safeTitle(Page page) {
        try {
            return page.title();
        } catch (PlaywrightException e) {
            log.trace("[Playwright] Title unavailable: {}", e.getMessage());
            return "";
        }
    }

    private String extractText(Page page) {
        try {
            Object text = page.evaluate(TEXT_SCRIPT);
            return text != null ? text.toString() : "";
        } catch (PlaywrightException e) {
            log.warn("[Playwright] Failed to extract text from page: {}", e.getMessage());
            return page.textContent("body");
        }
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_ELEMENT_TEXT ? text.substring(0, MAX_ELEMENT_TEXT) : text;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
