package me.golemcore.browser.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Input handed to the agent execution capability.
 */
@Data
@Builder
public class AgentRunRequest {
    private String taskId;
    private String description;
    private int maxSteps;
    private String model;
    private boolean useVision;
    /**
     * The task is reported failed after this instant; the agent should stop
     * between steps once it has passed.
     */
    private Instant deadline;
}
