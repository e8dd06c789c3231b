package me.golemcore.browser.testsupport;

import me.golemcore.browser.domain.model.SessionConfig;
import me.golemcore.browser.port.outbound.BrowserControlPort;
import me.golemcore.browser.port.outbound.BrowserProvisioningPort;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Hands out a {@link FakeBrowserControlPort} per session and remembers it by
 * session id.
 */
public class FakeBrowserProvisioner implements BrowserProvisioningPort {

    private final Map<String, FakeBrowserControlPort> ports = new ConcurrentHashMap<>();
    private final Map<String, SessionConfig> configs = new ConcurrentHashMap<>();
    private final AtomicInteger openCount = new AtomicInteger();

    private volatile Consumer<FakeBrowserControlPort> pageSetup = port -> {
    };
    private volatile RuntimeException failure;
    private volatile long launchDelayMs;

    public void setPageSetup(Consumer<FakeBrowserControlPort> pageSetup) {
        this.pageSetup = pageSetup;
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public void setLaunchDelayMs(long launchDelayMs) {
        this.launchDelayMs = launchDelayMs;
    }

    public FakeBrowserControlPort port(String sessionId) {
        return ports.get(sessionId);
    }

    public SessionConfig config(String sessionId) {
        return configs.get(sessionId);
    }

    public int getOpenCount() {
        return openCount.get();
    }

    @Override
    public BrowserControlPort open(String sessionId, SessionConfig config) {
        openCount.incrementAndGet();
        if (launchDelayMs > 0) {
            try {
                Thread.sleep(launchDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted", e);
            }
        }
        RuntimeException launchFailure = failure;
        if (launchFailure != null) {
            throw launchFailure;
        }
        FakeBrowserControlPort port = new FakeBrowserControlPort();
        pageSetup.accept(port);
        ports.put(sessionId, port);
        configs.put(sessionId, config);
        return port;
    }
}
