package me.golemcore.browser.domain.model;

import java.util.Locale;

public enum ScrollDirection {
    UP, DOWN;

    public static ScrollDirection fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
