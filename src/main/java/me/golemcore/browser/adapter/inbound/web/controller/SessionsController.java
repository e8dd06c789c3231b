package me.golemcore.browser.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.browser.adapter.inbound.web.OperationInvoker;
import me.golemcore.browser.domain.command.BrowserOperation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Browser session lifecycle endpoints.
 */
@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private final OperationInvoker invoker;

    @PostMapping
    public Mono<ResponseEntity<Object>> createSession(@RequestBody(required = false) Map<String, Object> body) {
        return invoker.invoke(BrowserOperation.CREATE_SESSION.getName(), body);
    }

    @GetMapping
    public Mono<ResponseEntity<Object>> listSessions() {
        return invoker.invoke(BrowserOperation.LIST_SESSIONS.getName(), Map.of());
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Object>> closeSession(@PathVariable String sessionId) {
        return invoker.invoke(BrowserOperation.CLOSE_SESSION.getName(), null,
                BrowserOperation.Params.SESSION_ID, sessionId);
    }
}
