package me.golemcore.browser.domain.model;

import java.util.Locale;

/**
 * Lifecycle of a browser session.
 */
public enum SessionStatus {
    ACTIVE, CLOSING, CLOSED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
