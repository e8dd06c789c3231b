package me.golemcore.browser.domain.service;

import me.golemcore.browser.domain.exception.ErrorKind;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.model.AllowedDomains;
import me.golemcore.browser.domain.model.BrowserState;
import me.golemcore.browser.domain.model.InteractiveElement;
import me.golemcore.browser.domain.model.ScrollDirection;
import me.golemcore.browser.domain.model.TabInfo;
import me.golemcore.browser.testsupport.FakeBrowserControlPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrowserSessionHandleTest {

    private static final String EXAMPLE_URL = "https://example.com";
    private static final Duration OPERATION_TIMEOUT = Duration.ofSeconds(5);

    private FakeBrowserControlPort port;
    private BrowserSessionHandle handle;

    @BeforeEach
    void setUp() {
        port = new FakeBrowserControlPort()
                .withPage(EXAMPLE_URL, "Example Domain",
                        link(0, "More information", "https://www.iana.org/domains/example"),
                        input(1, "Search"))
                .withPage("https://example.com/docs", "Docs");
        handle = newHandle(AllowedDomains.unrestricted(), OPERATION_TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        handle.close();
    }

    @Test
    void shouldNavigateActiveTab() {
        TabInfo tab = handle.navigate(EXAMPLE_URL, false);

        assertEquals(0, tab.getIndex());
        assertEquals(EXAMPLE_URL, tab.getUrl());
        assertEquals("Example Domain", tab.getTitle());
        assertEquals(1, handle.tabCount());
    }

    @Test
    void shouldCompleteBareHostWithHttps() {
        TabInfo tab = handle.navigate("example.com", false);

        assertEquals(EXAMPLE_URL, tab.getUrl());
    }

    @Test
    void shouldRejectNonHttpSchemes() {
        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> handle.navigate("file:///etc/passwd", false));

        assertEquals(ErrorKind.INVALID_PARAMETERS, error.getKind());
        assertTrue(port.getCommands().isEmpty());
    }

    @Test
    void shouldAcceptHttpSchemesInAnyCase() {
        TabInfo tab = handle.navigate("HTTPS://example.com", false);

        assertEquals(EXAMPLE_URL, tab.getUrl());
        assertEquals("http://Example.com/Path", BrowserSessionHandle.normalizeUrl("Http://Example.com/Path"));
    }

    @Test
    void shouldRejectNonHttpSchemesInAnyCase() {
        for (String url : List.of("JavaScript:alert(1)", "DATA:text/html,hi", "File:///etc/passwd",
                "FTP://example.com")) {
            OrchestrationException error = assertThrows(OrchestrationException.class,
                    () -> handle.navigate(url, false), url);

            assertEquals(ErrorKind.INVALID_PARAMETERS, error.getKind());
        }
        assertTrue(port.getCommands().isEmpty());
    }

    @Test
    void shouldOpenNewTabAndMakeItActive() {
        handle.navigate(EXAMPLE_URL, false);

        TabInfo opened = handle.navigate("https://example.com/docs", true);

        assertEquals(1, opened.getIndex());
        List<TabInfo> tabs = handle.listTabs();
        assertEquals(2, tabs.size());
        assertTrue(tabs.get(1).isActive());
        assertFalse(tabs.get(0).isActive());
    }

    @Test
    void shouldRejectDisallowedDomainWithoutChangingTabs() {
        handle.close();
        handle = newHandle(AllowedDomains.of(List.of("example.com")), OPERATION_TIMEOUT);
        handle.navigate(EXAMPLE_URL, false);

        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> handle.navigate("https://evil.org", true));

        assertEquals(ErrorKind.DOMAIN_NOT_ALLOWED, error.getKind());
        List<TabInfo> tabs = handle.listTabs();
        assertEquals(1, tabs.size());
        assertEquals(EXAMPLE_URL, tabs.get(0).getUrl());
    }

    @Test
    void shouldFailWithNotFoundForUnknownElementIndex() {
        handle.navigate(EXAMPLE_URL, false);

        OrchestrationException error = assertThrows(OrchestrationException.class, () -> handle.click(7, false));

        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
        assertEquals("Element with index 7 not found", error.getMessage());
        assertFalse(port.getCommands().stream().anyMatch(command -> command.startsWith("click")));
    }

    @Test
    void shouldFailClickOnPageWithoutElements() {
        OrchestrationException error = assertThrows(OrchestrationException.class, () -> handle.click(0, false));

        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
    }

    @Test
    void shouldClickElementInPlace() {
        handle.navigate(EXAMPLE_URL, false);

        Optional<TabInfo> opened = handle.click(0, false);

        assertTrue(opened.isEmpty());
        assertEquals("https://www.iana.org/domains/example", port.currentUrl());
    }

    @Test
    void shouldOpenLinkTargetInNewTab() {
        handle.navigate(EXAMPLE_URL, false);

        Optional<TabInfo> opened = handle.click(0, true);

        assertTrue(opened.isPresent());
        assertEquals(1, opened.get().getIndex());
        assertEquals(2, handle.tabCount());
    }

    @Test
    void shouldRejectNewTabLinkOutsideAllowList() {
        handle.close();
        handle = newHandle(AllowedDomains.of(List.of("example.com")), OPERATION_TIMEOUT);
        handle.navigate(EXAMPLE_URL, false);

        OrchestrationException error = assertThrows(OrchestrationException.class, () -> handle.click(0, true));

        assertEquals(ErrorKind.DOMAIN_NOT_ALLOWED, error.getKind());
        assertEquals(1, handle.tabCount());
    }

    @Test
    void shouldTypeIntoValidatedElement() {
        handle.navigate(EXAMPLE_URL, false);

        handle.type(1, "hello");

        assertTrue(port.getCommands().contains("type 1 hello"));
        assertThrows(OrchestrationException.class, () -> handle.type(5, "nope"));
    }

    @Test
    void shouldScrollPressKeyAndGoBack() {
        handle.navigate(EXAMPLE_URL, false);
        handle.navigate("https://example.com/docs", false);

        assertEquals(FakeBrowserControlPort.SCROLL_DISTANCE, handle.scroll(ScrollDirection.UP));
        handle.pressKey("Enter");
        handle.goBack();

        assertEquals(EXAMPLE_URL, port.currentUrl());
        assertTrue(port.getCommands().contains("scroll up"));
        assertTrue(port.getCommands().contains("key Enter"));
    }

    @Test
    void shouldIncludeScreenshotOnlyWhenRequested() {
        handle.navigate(EXAMPLE_URL, false);

        BrowserState plain = handle.getState(false);
        BrowserState withScreenshot = handle.getState(true);

        assertNull(plain.getScreenshot());
        assertEquals(FakeBrowserControlPort.SCREENSHOT, withScreenshot.getScreenshot());
        assertEquals("Example Domain", plain.getTitle());
        assertEquals(2, plain.getInteractiveElements().size());
    }

    @Test
    void shouldValidateTabIndexForSwitchAndClose() {
        handle.navigate(EXAMPLE_URL, false);
        handle.navigate("https://example.com/docs", true);

        OrchestrationException error = assertThrows(OrchestrationException.class, () -> handle.switchTab(2));
        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
        assertEquals("Tab with index 2 not found", error.getMessage());

        TabInfo switched = handle.switchTab(0);
        assertEquals(EXAMPLE_URL, switched.getUrl());

        TabInfo closed = handle.closeTab(1);
        assertEquals("https://example.com/docs", closed.getUrl());
        assertEquals(1, handle.tabCount());
        assertThrows(OrchestrationException.class, () -> handle.closeTab(1));
    }

    @Test
    void shouldRunCommandsOneAtATimeInArrivalOrder() throws Exception {
        CountDownLatch gate = port.holdCommands();
        ExecutorService callers = Executors.newFixedThreadPool(6);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                String key = "K" + i;
                futures.add(callers.submit(() -> handle.pressKey(key)));
                Thread.sleep(50);
            }
            gate.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            callers.shutdownNow();
        }

        assertEquals(1, port.getMaxConcurrentCommands());
        List<String> keys = port.getCommands().stream().filter(command -> command.startsWith("key")).toList();
        assertEquals(List.of("key K0", "key K1", "key K2", "key K3", "key K4", "key K5"), keys);
    }

    @Test
    void shouldTimeOutWithoutCancellingQueuedCommand() {
        handle.close();
        handle = newHandle(AllowedDomains.unrestricted(), Duration.ofMillis(100));
        CountDownLatch gate = port.holdCommands();

        OrchestrationException error = assertThrows(OrchestrationException.class, () -> handle.pressKey("Enter"));
        assertEquals(ErrorKind.TIMEOUT, error.getKind());

        gate.countDown();
        assertEquals(1, handle.tabCount());
        assertTrue(port.getCommands().contains("key Enter"));
    }

    @Test
    void shouldClassifyPortFailuresAsUpstream() {
        port.failNextCommand(new IllegalStateException("Target page crashed"));

        OrchestrationException error = assertThrows(OrchestrationException.class,
                () -> handle.navigate(EXAMPLE_URL, false));

        assertEquals(ErrorKind.UPSTREAM_FAILURE, error.getKind());
        assertEquals("Target page crashed", error.getMessage());
    }

    @Test
    void shouldRejectCommandsAfterClose() {
        handle.close();

        OrchestrationException error = assertThrows(OrchestrationException.class, () -> handle.listTabs());

        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
        assertEquals("Session s1 is closed", error.getMessage());
        assertTrue(handle.isClosed());
        assertTrue(port.isClosed());
    }

    @Test
    void shouldSwallowReleaseFailureOnClose() {
        port.failOnClose(new IllegalStateException("browser already gone"));

        handle.close();
        handle.close();

        assertTrue(port.isClosed());
        assertEquals(1, port.getCommands().stream().filter("close"::equals).count());
    }

    @Test
    void shouldConvertSecondsToDuration() {
        assertEquals(Duration.ZERO, BrowserSessionHandle.secondsToDuration(0));
        assertEquals(Duration.ZERO, BrowserSessionHandle.secondsToDuration(-1));
        assertEquals(Duration.ofMillis(500), BrowserSessionHandle.secondsToDuration(0.5));
    }

    private BrowserSessionHandle newHandle(AllowedDomains allowedDomains, Duration operationTimeout) {
        return new BrowserSessionHandle("s1", port, allowedDomains, Duration.ZERO, operationTimeout);
    }

    private static InteractiveElement link(int index, String text, String href) {
        return InteractiveElement.builder().index(index).tag("a").text(text).href(href).build();
    }

    private static InteractiveElement input(int index, String placeholder) {
        return InteractiveElement.builder().index(index).tag("input").text("").placeholder(placeholder).build();
    }
}
