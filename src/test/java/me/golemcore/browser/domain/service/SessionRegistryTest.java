package me.golemcore.browser.domain.service;

import me.golemcore.browser.domain.exception.ErrorKind;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.model.BrowserSession;
import me.golemcore.browser.domain.model.SessionConfig;
import me.golemcore.browser.domain.model.SessionStatus;
import me.golemcore.browser.domain.model.SessionSummary;
import me.golemcore.browser.infrastructure.config.BrowserApiProperties;
import me.golemcore.browser.testsupport.FakeBrowserProvisioner;
import me.golemcore.browser.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionRegistryTest {

    private FakeBrowserProvisioner provisioner;
    private BrowserApiProperties properties;
    private MutableClock clock;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        provisioner = new FakeBrowserProvisioner();
        properties = new BrowserApiProperties();
        properties.getSessions().setDefaultWaitBetweenActions(0);
        properties.getSessions().setOperationTimeout(Duration.ofSeconds(5));
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new SessionRegistry(provisioner, properties, clock);
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    @Test
    void shouldCreateAndListSessionOnce() {
        BrowserSession session = registry.create("s1", headless());

        assertEquals("s1", session.getId());
        assertEquals(SessionStatus.ACTIVE, session.getStatus());
        List<SessionSummary> summaries = registry.list();
        assertEquals(1, summaries.size());
        SessionSummary summary = summaries.get(0);
        assertEquals("s1", summary.getSessionId());
        assertEquals("active", summary.getStatus());
        assertEquals(1, summary.getTabCount());
        assertEquals("about:blank", summary.getUrl());
        assertFalse(summary.getHasAgent());
    }

    @Test
    void shouldGenerateIdWhenBlank() {
        BrowserSession session = registry.create("  ", headless());

        assertTrue(session.getId().matches("session_[0-9a-f]{8}"));
        assertSame(session, registry.get(session.getId()));
    }

    @Test
    void shouldRejectDuplicateIdWithConflict() {
        registry.create("s1", headless());

        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> registry.create("s1", headless()));

        assertEquals(ErrorKind.CONFLICT, error.getKind());
        assertEquals("Session s1 already exists", error.getMessage());
        assertEquals(1, provisioner.getOpenCount());
    }

    @Test
    void shouldAllowOnlyOneOfConcurrentCreatesWithSameId() throws Exception {
        provisioner.setLaunchDelayMs(100);
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Callable<Object> create = () -> {
                try {
                    return registry.create("race", headless());
                } catch (OrchestrationException e) {
                    return e.getKind();
                }
            };
            Future<Object> first = callers.submit(create);
            Future<Object> second = callers.submit(create);
            List<Object> outcomes = List.of(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));

            assertEquals(1, outcomes.stream().filter(BrowserSession.class::isInstance).count());
            assertTrue(outcomes.contains(ErrorKind.CONFLICT));
            assertEquals(1, provisioner.getOpenCount());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void shouldReportProvisioningFailureAndLeaveNoEntry() {
        provisioner.failWith(new IllegalStateException("Executable doesn't exist"));

        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> registry.create("s1", headless()));

        assertEquals(ErrorKind.PROVISIONING_ERROR, error.getKind());
        assertTrue(error.getMessage().contains("Executable doesn't exist"));
        assertEquals(0, registry.size());

        provisioner.failWith(null);
        assertNotNull(registry.create("s1", headless()));
    }

    @Test
    void shouldCloseSessionAndReleaseBrowser() {
        BrowserSession session = registry.create("s1", headless());

        registry.close("s1");

        assertEquals(SessionStatus.CLOSED, session.getStatus());
        assertTrue(provisioner.port("s1").isClosed());
        assertTrue(registry.list().isEmpty());
        OrchestrationException error = assertThrows(OrchestrationException.class, () -> registry.get("s1"));
        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
    }

    @Test
    void shouldReportNotFoundOnSecondClose() {
        registry.create("s1", headless());
        registry.close("s1");

        OrchestrationException error = assertThrows(OrchestrationException.class, () -> registry.close("s1"));

        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
        assertEquals("Session s1 not found", error.getMessage());
    }

    @Test
    void shouldRemoveSessionEvenWhenReleaseFails() {
        provisioner.setPageSetup(port -> port.failOnClose(new IllegalStateException("browser crashed")));
        registry.create("s1", headless());

        registry.close("s1");

        assertEquals(0, registry.size());
    }

    @Test
    void shouldCreateDefaultSessionLazilyOnce() throws Exception {
        provisioner.setLaunchDelayMs(100);
        ExecutorService callers = Executors.newFixedThreadPool(3);
        try {
            List<Future<BrowserSession>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(callers.submit(() -> registry.resolve(null)));
            }
            BrowserSession first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<BrowserSession> future : futures) {
                assertSame(first, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            callers.shutdownNow();
        }

        assertEquals(SessionRegistry.DEFAULT_SESSION_ID, registry.resolve("default").getId());
        assertEquals(1, provisioner.getOpenCount());
        assertTrue(provisioner.config("default").isHeadless());
    }

    @Test
    void shouldShareDefaultProvisioningFailureWithWaiters() {
        provisioner.failWith(new IllegalStateException("no display"));

        OrchestrationException error = assertThrows(OrchestrationException.class, () -> registry.resolve(""));

        assertEquals(ErrorKind.PROVISIONING_ERROR, error.getKind());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldResolveNamedSessionOrFailWithNotFound() {
        BrowserSession session = registry.create("s1", headless());

        assertSame(session, registry.resolve("s1"));
        assertEquals(ErrorKind.NOT_FOUND,
                assertThrows(OrchestrationException.class, () -> registry.resolve("missing")).getKind());
    }

    @Test
    void shouldIgnoreSurroundingWhitespaceInIdsOnEveryLookup() {
        BrowserSession session = registry.create(" s1 ", headless());

        assertEquals("s1", session.getId());
        assertSame(session, registry.get("s1 "));
        assertSame(session, registry.resolve(" s1"));
        assertSame(session, registry.get("s1"));

        registry.close(" s1 ");

        assertEquals(0, registry.size());
        assertEquals(SessionStatus.CLOSED, session.getStatus());
    }

    @Test
    void shouldResolvePaddedDefaultIdToDefaultSession() {
        BrowserSession session = registry.resolve(" default ");

        assertEquals(SessionRegistry.DEFAULT_SESSION_ID, session.getId());
        assertSame(session, registry.get("default"));
    }

    @Test
    void shouldListBrokenSessionWithError() {
        BrowserSession session = registry.create("s1", headless());
        session.getHandle().close();

        SessionSummary summary = registry.list().get(0);

        assertEquals(-1, summary.getTabCount());
        assertEquals("Session s1 is closed", summary.getError());
    }

    @Test
    void shouldListInCreationOrder() {
        registry.create("b", headless());
        registry.create("a", headless());
        registry.create("c", headless());

        List<String> ids = registry.list().stream().map(SessionSummary::getSessionId).toList();

        assertEquals(List.of("b", "a", "c"), ids);
    }

    @Test
    void shouldEvictIdleSessionsButKeepBusyOnes() {
        properties.getSessions().setIdleTtl(Duration.ofMinutes(30));
        BrowserSession idle = registry.create("idle", headless());
        BrowserSession busy = registry.create("busy", headless());
        BrowserSession recent = registry.create("recent", headless());
        busy.acquireTaskLease();

        clock.advance(Duration.ofMinutes(31));
        recent.touch(clock.instant());
        registry.evictIdleSessions();

        assertEquals(SessionStatus.CLOSED, idle.getStatus());
        assertEquals(List.of("busy", "recent"),
                registry.list().stream().map(SessionSummary::getSessionId).toList());
        busy.releaseTaskLease();
    }

    @Test
    void shouldCloseEverySessionOnCloseAll() {
        registry.create("s1", headless());
        registry.create("s2", headless());

        registry.closeAll();

        assertEquals(0, registry.size());
        assertTrue(provisioner.port("s1").isClosed());
        assertTrue(provisioner.port("s2").isClosed());
    }

    @Test
    void shouldMarkEphemeralSessions() {
        BrowserSession session = registry.createEphemeral("agent_task_1", headless());

        assertTrue(session.isEphemeral());
    }

    private static SessionConfig headless() {
        return SessionConfig.builder()
                .headless(true)
                .waitBetweenActions(0)
                .build();
    }
}
