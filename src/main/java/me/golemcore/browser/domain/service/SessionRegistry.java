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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.exception.ErrorKind;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.model.AllowedDomains;
import me.golemcore.browser.domain.model.BrowserSession;
import me.golemcore.browser.domain.model.SessionConfig;
import me.golemcore.browser.domain.model.SessionSummary;
import me.golemcore.browser.domain.model.TabInfo;
import me.golemcore.browser.infrastructure.config.BrowserApiProperties;
import me.golemcore.browser.port.outbound.BrowserControlPort;
import me.golemcore.browser.port.outbound.BrowserProvisioningPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every live browser session of the process.
 *
 * <p>
 * The id → session map and the set of ids being provisioned are only mutated
 * while holding {@link #lock}. Provisioning a browser and releasing one both
 * happen outside the lock, so a slow launch never blocks other sessions:
 * the id is reserved first, which makes a concurrent create with the same id
 * fail with CONFLICT, and concurrent requests for the default session wait
 * on the same provisioning.
 *
 * <p>
 * Sessions idle longer than {@code browser-api.sessions.idle-ttl} are closed
 * by a background sweep unless an agent task is running against them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionRegistry {

    public static final String DEFAULT_SESSION_ID = "default";

    private static final String LOG_PREFIX = "[Sessions]";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;
    private static final int GENERATED_ID_LENGTH = 8;

    private final BrowserProvisioningPort provisioningPort;
    private final BrowserApiProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, BrowserSession> sessions = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<BrowserSession>> provisioning = new HashMap<>();

    private final ScheduledExecutorService evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "session-eviction");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        Duration idleTtl = properties.getSessions().getIdleTtl();
        if (idleTtl == null || idleTtl.isZero() || idleTtl.isNegative()) {
            log.info("{} Idle session eviction disabled", LOG_PREFIX);
            return;
        }
        long intervalMs = properties.getSessions().getEvictionInterval().toMillis();
        evictionExecutor.scheduleAtFixedRate(this::evictIdleSessions, intervalMs, intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("{} Idle sessions are closed after {}", LOG_PREFIX, idleTtl);
    }

    @PreDestroy
    void destroy() {
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        closeAll();
    }

    /**
     * Provision and register a new session.
     *
     * @param id
     *            requested id, or blank to generate one
     * @throws OrchestrationException
     *             CONFLICT if the id is active or being provisioned,
     *             PROVISIONING_ERROR if the browser could not be launched
     */
    public BrowserSession create(String id, SessionConfig config) {
        String sessionId = id == null || id.isBlank() ? generateSessionId() : id.trim();
        CompletableFuture<BrowserSession> pending = reserve(sessionId);
        return provision(sessionId, config != null ? config : defaultConfig(), false, pending);
    }

    /**
     * Provision a private session for one agent task. Ephemeral sessions are
     * listed like any other but flagged so callers can tell them apart.
     */
    public BrowserSession createEphemeral(String id, SessionConfig config) {
        CompletableFuture<BrowserSession> pending = reserve(id);
        return provision(id, config, true, pending);
    }

    /**
     * Look up a registered session. Surrounding whitespace in the id is
     * ignored, as it is by {@link #create} and {@link #close}.
     */
    public BrowserSession get(String id) {
        String sessionId = trimId(id);
        lock.lock();
        try {
            BrowserSession session = sessions.get(sessionId);
            if (session == null) {
                throw OrchestrationException.notFound("Session " + sessionId + " not found");
            }
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the default session, creating it with the configured defaults on
     * first use.
     */
    public BrowserSession getOrCreateDefault() {
        CompletableFuture<BrowserSession> pending;
        boolean owner = false;
        lock.lock();
        try {
            BrowserSession existing = sessions.get(DEFAULT_SESSION_ID);
            if (existing != null) {
                return existing;
            }
            pending = provisioning.get(DEFAULT_SESSION_ID);
            if (pending == null) {
                pending = new CompletableFuture<>();
                provisioning.put(DEFAULT_SESSION_ID, pending);
                owner = true;
            }
        } finally {
            lock.unlock();
        }
        if (owner) {
            log.info("{} Creating default session on first use", LOG_PREFIX);
            return provision(DEFAULT_SESSION_ID, defaultConfig(), false, pending);
        }
        return awaitProvisioning(pending);
    }

    /**
     * Resolve the session an operation targets: blank or {@code "default"}
     * means the lazily created default session.
     */
    public BrowserSession resolve(String id) {
        String sessionId = trimId(id);
        if (sessionId == null || sessionId.isEmpty() || DEFAULT_SESSION_ID.equals(sessionId)) {
            return getOrCreateDefault();
        }
        return get(sessionId);
    }

    /**
     * Point-in-time listing in creation order. Tab counts are read through each
     * session's handle; a session whose browser cannot be queried is still
     * listed, with {@code tabCount = -1} and the error message.
     */
    public List<SessionSummary> list() {
        List<BrowserSession> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }

        List<SessionSummary> summaries = new ArrayList<>(snapshot.size());
        for (BrowserSession session : snapshot) {
            SessionSummary.SessionSummaryBuilder summary = SessionSummary.builder()
                    .sessionId(session.getId())
                    .config(session.getConfig())
                    .status(session.getStatus().wireName())
                    .hasAgent(session.hasActiveTasks())
                    .createdAt(session.getCreatedAt())
                    .lastActivityAt(session.getLastActivityAt());
            try {
                List<TabInfo> tabs = session.getHandle().listTabs();
                summary.tabCount(tabs.size());
                tabs.stream().filter(TabInfo::isActive).findFirst()
                        .ifPresent(active -> summary.url(active.getUrl()));
            } catch (OrchestrationException e) {
                summary.tabCount(-1).error(e.getMessage());
            }
            summaries.add(summary.build());
        }
        return summaries;
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the session and release its browser. The entry is removed before
     * the release is attempted, so a failing release never leaves a reachable
     * session behind.
     *
     * @throws OrchestrationException
     *             NOT_FOUND if no such session is registered
     */
    public void close(String rawId) {
        String id = trimId(rawId);
        BrowserSession session;
        lock.lock();
        try {
            session = sessions.remove(id);
        } finally {
            lock.unlock();
        }
        if (session == null) {
            throw OrchestrationException.notFound("Session " + id + " not found");
        }
        session.markClosing();
        try {
            session.getHandle().close();
        } catch (RuntimeException e) {
            log.warn("{} Error releasing session {}: {}", LOG_PREFIX, id, e.getMessage(), e);
        } finally {
            session.markClosed();
        }
        log.info("{} Closed session {}", LOG_PREFIX, id);
    }

    /**
     * Close every registered session. Used at shutdown.
     */
    public void closeAll() {
        List<String> ids;
        lock.lock();
        try {
            ids = new ArrayList<>(sessions.keySet());
        } finally {
            lock.unlock();
        }
        if (ids.isEmpty()) {
            return;
        }
        log.info("{} Closing {} sessions", LOG_PREFIX, ids.size());
        for (String id : ids) {
            closeQuietly(id);
        }
    }

    void evictIdleSessions() {
        Duration idleTtl = properties.getSessions().getIdleTtl();
        Instant cutoff = clock.instant().minus(idleTtl);
        List<String> idle = new ArrayList<>();
        lock.lock();
        try {
            for (BrowserSession session : sessions.values()) {
                if (session.isActive() && !session.hasActiveTasks()
                        && session.getLastActivityAt().isBefore(cutoff)) {
                    idle.add(session.getId());
                }
            }
        } finally {
            lock.unlock();
        }
        for (String id : idle) {
            log.info("{} Evicting session {} idle for more than {}", LOG_PREFIX, id, idleTtl);
            closeQuietly(id);
        }
    }

    private void closeQuietly(String id) {
        try {
            close(id);
        } catch (OrchestrationException e) {
            if (e.getKind() != ErrorKind.NOT_FOUND) {
                log.warn("{} Failed to close session {}: {}", LOG_PREFIX, id, e.getMessage());
            }
        } catch (RuntimeException e) { // NOSONAR
            log.error("{} Unexpected error closing session {}", LOG_PREFIX, id, e);
        }
    }

    private static String trimId(String id) {
        return id != null ? id.trim() : null;
    }

    private CompletableFuture<BrowserSession> reserve(String sessionId) {
        CompletableFuture<BrowserSession> pending = new CompletableFuture<>();
        lock.lock();
        try {
            if (sessions.containsKey(sessionId) || provisioning.containsKey(sessionId)) {
                throw OrchestrationException.conflict("Session " + sessionId + " already exists");
            }
            provisioning.put(sessionId, pending);
        } finally {
            lock.unlock();
        }
        return pending;
    }

    private BrowserSession provision(String sessionId, SessionConfig config, boolean ephemeral,
            CompletableFuture<BrowserSession> pending) {
        try {
            BrowserControlPort port = provisioningPort.open(sessionId, config);
            BrowserSessionHandle handle = new BrowserSessionHandle(
                    sessionId,
                    port,
                    AllowedDomains.of(config.getAllowedDomains()),
                    BrowserSessionHandle.secondsToDuration(config.getWaitBetweenActions()),
                    properties.getSessions().getOperationTimeout());
            BrowserSession session = BrowserSession.builder()
                    .id(sessionId)
                    .config(config)
                    .handle(handle)
                    .createdAt(clock.instant())
                    .ephemeral(ephemeral)
                    .build();

            lock.lock();
            try {
                provisioning.remove(sessionId);
                sessions.put(sessionId, session);
            } finally {
                lock.unlock();
            }
            pending.complete(session);
            log.info("{} Created session {} (headless: {}, allowed domains: {})", LOG_PREFIX, sessionId,
                    config.isHeadless(), handle.getAllowedDomains());
            return session;
        } catch (RuntimeException e) {
            OrchestrationException failure = toProvisioningError(sessionId, e);
            lock.lock();
            try {
                provisioning.remove(sessionId);
            } finally {
                lock.unlock();
            }
            pending.completeExceptionally(failure);
            log.warn("{} {}", LOG_PREFIX, failure.getMessage());
            throw failure;
        }
    }

    private BrowserSession awaitProvisioning(CompletableFuture<BrowserSession> pending) {
        try {
            return pending.get();
        } catch (ExecutionException e) {
            throw OrchestrationException.classify(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OrchestrationException.provisioning("Interrupted while waiting for session", e);
        }
    }

    private static OrchestrationException toProvisioningError(String sessionId, RuntimeException e) {
        if (e instanceof OrchestrationException orchestrationException
                && orchestrationException.getKind() == ErrorKind.PROVISIONING_ERROR) {
            return orchestrationException;
        }
        return OrchestrationException.provisioning(
                "Failed to start browser for session " + sessionId + ": " + e.getMessage(), e);
    }

    private SessionConfig defaultConfig() {
        return SessionConfig.builder()
                .headless(properties.getSessions().isDefaultHeadless())
                .waitBetweenActions(properties.getSessions().getDefaultWaitBetweenActions())
                .build();
    }

    private String generateSessionId() {
        return "session_" + UUID.randomUUID().toString().replace("-", "").substring(0, GENERATED_ID_LENGTH);
    }
}
