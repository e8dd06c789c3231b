package me.golemcore.browser.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of a session returned by listings. {@code tabCount} is
 * -1 and {@code error} is set when the browser could not be queried.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionSummary {
    private String sessionId;
    private SessionConfig config;
    private String status;
    private int tabCount;
    private String url;
    private Boolean hasAgent;
    private Instant createdAt;
    private Instant lastActivityAt;
    private String error;
}
