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
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.Request;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.AllowedDomains;
import me.golemcore.browser.domain.model.SessionConfig;
import me.golemcore.browser.infrastructure.config.BrowserApiProperties;
import me.golemcore.browser.port.outbound.BrowserControlPort;
import me.golemcore.browser.port.outbound.BrowserProvisioningPort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Launches one Chromium browser per session with Microsoft Playwright.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Headless or headed launch per session</li>
 * <li>Persistent profile when {@code user_data_dir} is given</li>
 * <li>Custom user agent and viewport from {@code browser-api.browser.*}</li>
 * <li>Top-level navigations to hosts outside the session allow-list are
 * aborted inside the browser, covering link clicks and redirects</li>
 * </ul>
 *
 * <p>
 * Partially created resources are released when the launch fails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaywrightBrowserProvisioner implements BrowserProvisioningPort {

    private final BrowserApiProperties properties;

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public BrowserControlPort open(String sessionId, SessionConfig config) {
        BrowserApiProperties.BrowserProperties browserProps = properties.getBrowser();
        Playwright pw = null;
        Browser br = null;
        try {
            pw = Playwright.create();
            BrowserContext context;
            if (config.getUserDataDir() != null && !config.getUserDataDir().isBlank()) {
                Path profileDir = Paths.get(config.getUserDataDir());
                BrowserType.LaunchPersistentContextOptions options = new BrowserType.LaunchPersistentContextOptions()
                        .setHeadless(config.isHeadless())
                        .setViewportSize(browserProps.getViewportWidth(), browserProps.getViewportHeight());
                if (hasText(browserProps.getUserAgent())) {
                    options.setUserAgent(browserProps.getUserAgent());
                }
                context = pw.chromium().launchPersistentContext(profileDir, options);
            } else {
                br = pw.chromium().launch(new BrowserType.LaunchOptions().setHeadless(config.isHeadless()));
                Browser.NewContextOptions options = new Browser.NewContextOptions()
                        .setViewportSize(browserProps.getViewportWidth(), browserProps.getViewportHeight());
                if (hasText(browserProps.getUserAgent())) {
                    options.setUserAgent(browserProps.getUserAgent());
                }
                context = br.newContext(options);
            }
            restrictNavigation(sessionId, context, AllowedDomains.of(config.getAllowedDomains()));

            log.info("[Playwright] Browser launched for session {} (headless: {}, profile: {})", sessionId,
                    config.isHeadless(), config.getUserDataDir() != null ? config.getUserDataDir() : "none");
            return new PlaywrightBrowserControl(sessionId, pw, br, context,
                    browserProps.getNavigationTimeout().toMillis());
        } catch (RuntimeException e) {
            log.warn("[Playwright] Failed to launch browser for session {}: {}", sessionId, e.getMessage());
            closeQuietly(br);
            closeQuietly(pw);
            throw e;
        }
    }

    private void restrictNavigation(String sessionId, BrowserContext context, AllowedDomains allowedDomains) {
        if (allowedDomains.isUnrestricted()) {
            return;
        }
        context.route("**/*", route -> {
            Request request = route.request();
            if (request.isNavigationRequest() && !allowedDomains.permits(request.url())) {
                log.info("[Playwright] Blocked navigation to {} in session {}", request.url(), sessionId);
                route.abort("blockedbyclient");
            } else {
                route.resume();
            }
        });
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception ex) {
            log.trace("Error closing browser resource: {}", ex.getMessage());
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
