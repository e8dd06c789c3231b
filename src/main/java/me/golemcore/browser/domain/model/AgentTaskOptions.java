package me.golemcore.browser.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-task options. {@code allowedDomains} and {@code headless} only apply
 * when the task provisions its own session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTaskOptions {
    @Builder.Default
    private List<String> allowedDomains = new ArrayList<>();
    @Builder.Default
    private boolean useVision = true;
    @Builder.Default
    private boolean headless = true;
}
