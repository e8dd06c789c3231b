package me.golemcore.browser.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.browser.domain.exception.ErrorKind;
import me.golemcore.browser.domain.exception.OrchestrationException;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps orchestration failures to HTTP statuses and the {@code {"detail"}}
 * envelope.
 */
@ControllerAdvice(basePackages = "me.golemcore.browser.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(OrchestrationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleOrchestration(OrchestrationException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        } else {
            log.debug("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        }
        return respond(status, ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(DecodingException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleDecoding(DecodingException ex) {
        log.warn("[API] Malformed request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
        case INVALID_PARAMETERS, UNKNOWN_OPERATION, DOMAIN_NOT_ALLOWED -> HttpStatus.BAD_REQUEST;
        case NOT_FOUND -> HttpStatus.NOT_FOUND;
        case CONFLICT -> HttpStatus.CONFLICT;
        case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        case PROVISIONING_ERROR, UPSTREAM_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String detail) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .detail(detail)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
