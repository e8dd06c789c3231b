package me.golemcore.browser.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome reported by the agent execution capability.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentRunResult {
    private boolean successful;
    private String finalResult;
    private int stepsCompleted;
    @Builder.Default
    private List<String> urlsVisited = new ArrayList<>();
    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
