package me.golemcore.browser.domain.model;

import java.util.Locale;

/**
 * Agent task state machine: PENDING → RUNNING → COMPLETED | FAILED.
 */
public enum AgentTaskStatus {
    PENDING, RUNNING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
