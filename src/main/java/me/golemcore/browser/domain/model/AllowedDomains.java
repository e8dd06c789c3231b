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

package me.golemcore.browser.domain.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Navigation allow-list of a session, built once from
 * {@link SessionConfig#getAllowedDomains()} when the session is created.
 *
 * <p>
 * Matching rules:
 * <ul>
 * <li>an empty list permits every host</li>
 * <li>{@code example.com} permits {@code example.com} and any subdomain of
 * it</li>
 * <li>{@code *.example.com} is treated the same as {@code example.com}</li>
 * <li>entries may be written as URLs; only their host is used</li>
 * </ul>
 */
public final class AllowedDomains {

    private static final AllowedDomains UNRESTRICTED = new AllowedDomains(List.of());

    private final List<String> domains;

    private AllowedDomains(List<String> domains) {
        this.domains = domains;
    }

    public static AllowedDomains unrestricted() {
        return UNRESTRICTED;
    }

    public static AllowedDomains of(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return UNRESTRICTED;
        }
        List<String> normalized = new ArrayList<>();
        for (String entry : configured) {
            String domain = normalizeEntry(entry);
            if (!domain.isEmpty()) {
                normalized.add(domain);
            }
        }
        return normalized.isEmpty() ? UNRESTRICTED : new AllowedDomains(Collections.unmodifiableList(normalized));
    }

    public boolean isUnrestricted() {
        return domains.isEmpty();
    }

    public List<String> getDomains() {
        return domains;
    }

    /**
     * Returns whether navigating to {@code url} is permitted. URLs without a
     * parsable host are rejected when the list is non-empty.
     */
    public boolean permits(String url) {
        if (isUnrestricted()) {
            return true;
        }
        String host = hostOf(url);
        if (host == null) {
            return false;
        }
        for (String domain : domains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    static String hostOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String normalizeEntry(String entry) {
        if (entry == null) {
            return "";
        }
        String value = entry.trim().toLowerCase(Locale.ROOT);
        if (value.contains("://")) {
            String host = hostOf(value.replace("*.", ""));
            value = host != null ? host : "";
        }
        if (value.startsWith("*.")) {
            value = value.substring(2);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        int port = value.indexOf(':');
        if (port >= 0) {
            value = value.substring(0, port);
        }
        return value;
    }

    @Override
    public String toString() {
        return isUnrestricted() ? "*" : String.join(",", domains);
    }
}
