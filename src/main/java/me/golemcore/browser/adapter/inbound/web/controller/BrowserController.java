package me.golemcore.browser.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.browser.adapter.inbound.web.OperationInvoker;
import me.golemcore.browser.domain.command.BrowserOperation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Direct browser control endpoints. Each body carries the operation
 * parameters; {@code session_id} defaults to the shared default session. Tab
 * listing takes the session id as a query parameter.
 */
@RestController
@RequestMapping("/browser")
@RequiredArgsConstructor
public class BrowserController {

    private final OperationInvoker invoker;

    @PostMapping("/navigate")
    public Mono<ResponseEntity<Object>> navigate(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.NAVIGATE, body);
    }

    @PostMapping("/click")
    public Mono<ResponseEntity<Object>> click(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.CLICK, body);
    }

    @PostMapping("/type")
    public Mono<ResponseEntity<Object>> type(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.TYPE, body);
    }

    @PostMapping("/key")
    public Mono<ResponseEntity<Object>> pressKey(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.PRESS_KEY, body);
    }

    @PostMapping("/scroll")
    public Mono<ResponseEntity<Object>> scroll(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.SCROLL, body);
    }

    @PostMapping("/back")
    public Mono<ResponseEntity<Object>> goBack(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.GO_BACK, body);
    }

    @PostMapping("/state")
    public Mono<ResponseEntity<Object>> getState(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.GET_STATE, body);
    }

    @GetMapping("/tabs")
    public Mono<ResponseEntity<Object>> listTabs(
            @RequestParam(name = "session_id", required = false) String sessionId) {
        Map<String, Object> params = sessionId != null
                ? Map.of(BrowserOperation.Params.SESSION_ID, sessionId)
                : Map.of();
        return invoke(BrowserOperation.LIST_TABS, params);
    }

    @PostMapping("/tabs/switch")
    public Mono<ResponseEntity<Object>> switchTab(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.SWITCH_TAB, body);
    }

    @PostMapping("/tabs/close")
    public Mono<ResponseEntity<Object>> closeTab(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.CLOSE_TAB, body);
    }

    @PostMapping("/extract")
    public Mono<ResponseEntity<Object>> extractContent(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.EXTRACT_CONTENT, body);
    }

    @PostMapping("/retry_with_agent")
    public Mono<ResponseEntity<Object>> retryWithAgent(@RequestBody(required = false) Map<String, Object> body) {
        return invoke(BrowserOperation.RETRY_WITH_AGENT, body);
    }

    private Mono<ResponseEntity<Object>> invoke(BrowserOperation operation, Map<String, Object> body) {
        return invoker.invoke(operation.getName(), body);
    }
}
