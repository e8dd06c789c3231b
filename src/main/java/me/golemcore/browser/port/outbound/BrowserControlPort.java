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

package me.golemcore.browser.port.outbound;

import me.golemcore.browser.domain.model.BrowserPage;
import me.golemcore.browser.domain.model.BrowserState;
import me.golemcore.browser.domain.model.InteractiveElement;
import me.golemcore.browser.domain.model.ScrollDirection;
import me.golemcore.browser.domain.model.TabInfo;

import java.util.List;

/**
 * Port for controlling one browser context. Implementations are not required
 * to be thread-safe: every call is serialized by
 * {@link me.golemcore.browser.domain.service.BrowserSessionHandle}.
 *
 * <p>
 * Index arguments are validated by the caller against a list fetched
 * immediately before the call.
 */
public interface BrowserControlPort {

    /**
     * Navigate the active tab and return it after the DOM has loaded.
     */
    TabInfo navigate(String url);

    /**
     * Append a new tab, load {@code url} in it and make it the active tab.
     */
    TabInfo openTab(String url);

    /**
     * Index the interactive elements of the active page. Indices returned here
     * are the ones accepted by {@link #click} and {@link #type}.
     */
    List<InteractiveElement> interactiveElements();

    /**
     * Click an element. With {@code newTab} the click is modified so that
     * links open in a new tab where the page allows it.
     */
    void click(int index, boolean newTab);

    void type(int index, String text);

    void pressKey(String key);

    /**
     * Scroll the active page by one viewport height and return the distance
     * in pixels.
     */
    int scroll(ScrollDirection direction);

    void goBack();

    BrowserState state(boolean includeScreenshot);

    BrowserPage readPage();

    List<TabInfo> tabs();

    TabInfo switchTab(int index);

    TabInfo closeTab(int index);

    /**
     * Release the browser context and everything launched for it.
     */
    void close();
}
