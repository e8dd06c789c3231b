package me.golemcore.browser.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.adapter.inbound.web.OperationInvoker;
import me.golemcore.browser.adapter.inbound.web.dto.McpInvocationRequest;
import me.golemcore.browser.domain.command.OperationDefinition;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.service.CommandDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic tool-style endpoint: any operation by name with a parameter map.
 */
@RestController
@RequestMapping("/mcp")
@RequiredArgsConstructor
@Slf4j
public class McpController {

    private final CommandDispatcher dispatcher;
    private final OperationInvoker invoker;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> listTools() {
        List<OperationDefinition> definitions = dispatcher.listOperations();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("available_tools", definitions.stream().map(OperationDefinition::getName).toList());
        response.put("tools", definitions);
        return Mono.just(ResponseEntity.ok(response));
    }

    @PostMapping
    public Mono<ResponseEntity<Object>> invoke(@RequestBody McpInvocationRequest request) {
        String toolName = request.getToolName();
        if (toolName == null || toolName.isBlank()) {
            return Mono.error(OrchestrationException.invalidParameters("tool_name is required"));
        }
        log.debug("[MCP] Invoking {}", toolName);
        return invoker.invoke(toolName, request.getParameters());
    }
}
