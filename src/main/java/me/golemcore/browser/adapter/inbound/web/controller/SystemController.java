package me.golemcore.browser.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.browser.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.browser.adapter.inbound.web.dto.ServiceInfoResponse;
import me.golemcore.browser.domain.service.AgentTaskManager;
import me.golemcore.browser.domain.service.SessionRegistry;
import me.golemcore.browser.port.outbound.AgentExecutionPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Service info and health endpoints.
 */
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final SessionRegistry sessionRegistry;
    private final AgentTaskManager agentTaskManager;
    private final AgentExecutionPort agentExecutionPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @GetMapping("/")
    public Mono<ResponseEntity<ServiceInfoResponse>> info() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        ServiceInfoResponse response = ServiceInfoResponse.builder()
                .message("Browser Automation API Server")
                .version(buildProps != null ? buildProps.getVersion() : "dev")
                .docs("/mcp")
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        HealthResponse response = HealthResponse.builder()
                .status("healthy")
                .activeSessions(sessionRegistry.size())
                .activeTasks(agentTaskManager.countActive())
                .llmConfigured(agentExecutionPort.isAvailable())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
