package me.golemcore.browser.domain.model;

import lombok.Builder;
import lombok.Getter;
import me.golemcore.browser.domain.service.BrowserSessionHandle;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A managed browser-automation context. Owns its {@link BrowserSessionHandle}
 * exclusively; the handle is never shared with another session.
 */
@Getter
public class BrowserSession {

    private final String id;
    private final SessionConfig config;
    private final BrowserSessionHandle handle;
    private final Instant createdAt;
    private final boolean ephemeral;

    private volatile Instant lastActivityAt;
    private volatile SessionStatus status = SessionStatus.ACTIVE;
    private final AtomicInteger activeTaskCount = new AtomicInteger();

    @Builder
    public BrowserSession(String id, SessionConfig config, BrowserSessionHandle handle, Instant createdAt,
            boolean ephemeral) {
        this.id = id;
        this.config = config;
        this.handle = handle;
        this.createdAt = createdAt;
        this.ephemeral = ephemeral;
        this.lastActivityAt = createdAt;
    }

    public void touch(Instant now) {
        this.lastActivityAt = now;
    }

    public void markClosing() {
        this.status = SessionStatus.CLOSING;
    }

    public void markClosed() {
        this.status = SessionStatus.CLOSED;
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    /**
     * Marks an agent task as running against this session so idle eviction
     * leaves it alone.
     */
    public void acquireTaskLease() {
        activeTaskCount.incrementAndGet();
    }

    public void releaseTaskLease() {
        activeTaskCount.decrementAndGet();
    }

    public boolean hasActiveTasks() {
        return activeTaskCount.get() > 0;
    }
}
