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
 * Immutable copy of an {@link AgentTask} taken under the task's lock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentTaskSnapshot {
    private String taskId;
    private String sessionId;
    private boolean ephemeralSession;
    private String task;
    private int maxSteps;
    private String model;
    private String status;
    private AgentRunResult result;
    private String error;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
}
