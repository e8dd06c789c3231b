package me.golemcore.browser.domain.command;

/**
 * Routing class of an operation.
 */
public enum OperationClass {
    /** Create, list and close sessions; handled by the registry. */
    SESSION_LIFECYCLE,
    /** Synchronous browser commands on the resolved session's handle. */
    BROWSER_CONTROL,
    /** Synchronous LLM extraction from the current page. */
    EXTRACTION,
    /** Asynchronous agent tasks and their status. */
    AGENT_TASK
}
