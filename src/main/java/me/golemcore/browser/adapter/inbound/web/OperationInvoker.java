package me.golemcore.browser.adapter.inbound.web;

import lombok.RequiredArgsConstructor;
import me.golemcore.browser.domain.service.CommandDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs dispatcher calls off the event loop. Browser commands and LLM calls
 * block, so every invocation is moved to the bounded elastic scheduler.
 */
@Component
@RequiredArgsConstructor
public class OperationInvoker {

    private final CommandDispatcher dispatcher;

    public Mono<ResponseEntity<Object>> invoke(String operationName, Map<String, Object> parameters) {
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        return Mono.fromCallable(() -> dispatcher.invoke(operationName, params))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    /**
     * Same as {@link #invoke(String, Map)} with one path variable merged into
     * the body parameters. The path value wins over a body value of the same
     * name.
     */
    public Mono<ResponseEntity<Object>> invoke(String operationName, Map<String, Object> parameters,
            String pathParameter, String pathValue) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (parameters != null) {
            merged.putAll(parameters);
        }
        merged.put(pathParameter, pathValue);
        return invoke(operationName, merged);
    }
}
