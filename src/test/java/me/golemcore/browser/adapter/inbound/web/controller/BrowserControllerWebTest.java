package me.golemcore.browser.adapter.inbound.web.controller;

import me.golemcore.browser.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.browser.adapter.inbound.web.OperationInvoker;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.service.CommandDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrowserControllerWebTest {

    private CommandDispatcher dispatcher;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        dispatcher = mock(CommandDispatcher.class);
        BrowserController controller = new BrowserController(new OperationInvoker(dispatcher));

        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldNavigateWithBodyParameters() {
        when(dispatcher.invoke(eq("browser_navigate"), any()))
                .thenReturn(Map.of("message", "Navigated to: https://example.com"));

        webTestClient.post()
                .uri("/browser/navigate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("url", "example.com", "session_id", "s1"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Navigated to: https://example.com");

        ArgumentCaptor<Map<String, ?>> params = ArgumentCaptor.forClass(Map.class);
        verify(dispatcher).invoke(eq("browser_navigate"), params.capture());
        assertEquals("example.com", params.getValue().get("url"));
        assertEquals("s1", params.getValue().get("session_id"));
    }

    @Test
    void shouldRouteEveryEndpointToItsOperation() {
        Map<String, String> routes = Map.ofEntries(
                Map.entry("/browser/click", "browser_click"),
                Map.entry("/browser/type", "browser_type"),
                Map.entry("/browser/key", "browser_key"),
                Map.entry("/browser/scroll", "browser_scroll"),
                Map.entry("/browser/back", "browser_go_back"),
                Map.entry("/browser/state", "browser_get_state"),
                Map.entry("/browser/tabs/switch", "browser_switch_tab"),
                Map.entry("/browser/tabs/close", "browser_close_tab"),
                Map.entry("/browser/extract", "browser_extract_content"),
                Map.entry("/browser/retry_with_agent", "retry_with_browser_use_agent"));
        routes.forEach((uri, operation) -> {
            when(dispatcher.invoke(eq(operation), any())).thenReturn(Map.of("operation", operation));

            webTestClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.operation").isEqualTo(operation);
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldListTabsWithSessionIdFromQuery() {
        when(dispatcher.invoke(eq("browser_list_tabs"), any()))
                .thenReturn(Map.of("message", "Open tabs:"));

        webTestClient.get()
                .uri("/browser/tabs?session_id=s1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Open tabs:");

        ArgumentCaptor<Map<String, ?>> params = ArgumentCaptor.forClass(Map.class);
        verify(dispatcher).invoke(eq("browser_list_tabs"), params.capture());
        assertEquals("s1", params.getValue().get("session_id"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldListTabsOfDefaultSessionWithoutQuery() {
        when(dispatcher.invoke(eq("browser_list_tabs"), any()))
                .thenReturn(Map.of("message", "Open tabs:"));

        webTestClient.get()
                .uri("/browser/tabs")
                .exchange()
                .expectStatus().isOk();

        ArgumentCaptor<Map<String, ?>> params = ArgumentCaptor.forClass(Map.class);
        verify(dispatcher).invoke(eq("browser_list_tabs"), params.capture());
        assertFalse(params.getValue().containsKey("session_id"));
    }

    @Test
    void shouldMapInvalidParametersToBadRequest() {
        when(dispatcher.invoke(eq("browser_click"), any()))
                .thenThrow(OrchestrationException.invalidParameters(
                        "Parameter 'index' of browser_click must be an integer"));

        webTestClient.post()
                .uri("/browser/click")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("index", "first"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Parameter 'index' of browser_click must be an integer");
    }

    @Test
    void shouldMapDisallowedDomainToBadRequest() {
        when(dispatcher.invoke(eq("browser_navigate"), any()))
                .thenThrow(OrchestrationException.domainNotAllowed("Domain evil.test is not allowed"));

        webTestClient.post()
                .uri("/browser/navigate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("url", "https://evil.test"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Domain evil.test is not allowed");
    }

    @Test
    void shouldMapMissingElementToNotFound() {
        when(dispatcher.invoke(eq("browser_click"), any()))
                .thenThrow(OrchestrationException.notFound("Element with index 7 not found"));

        webTestClient.post()
                .uri("/browser/click")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("index", 7))
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void shouldMapTimeoutToGatewayTimeout() {
        when(dispatcher.invoke(eq("browser_get_state"), any()))
                .thenThrow(OrchestrationException.timeout("get_state timed out after 60000 ms"));

        webTestClient.post()
                .uri("/browser/state")
                .exchange()
                .expectStatus().isEqualTo(504)
                .expectBody()
                .jsonPath("$.detail").isEqualTo("get_state timed out after 60000 ms");
    }

    @Test
    void shouldMapUpstreamFailureToInternalError() {
        when(dispatcher.invoke(eq("browser_extract_content"), any()))
                .thenThrow(OrchestrationException.upstream("Content extraction is unavailable"));

        webTestClient.post()
                .uri("/browser/extract")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "prices"))
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Content extraction is unavailable");
    }

    @Test
    void shouldHideUnexpectedFailureDetails() {
        when(dispatcher.invoke(eq("browser_scroll"), any()))
                .thenThrow(new NullPointerException("page was null"));

        webTestClient.post()
                .uri("/browser/scroll")
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Internal server error");
    }

    @Test
    void shouldRejectMalformedJson() {
        webTestClient.post()
                .uri("/browser/navigate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"url\": ")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
