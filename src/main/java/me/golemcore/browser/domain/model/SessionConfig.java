package me.golemcore.browser.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Launch configuration of a browser session. Fixed for the lifetime of the
 * session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionConfig {

    @Builder.Default
    private boolean headless = true;
    @Builder.Default
    private List<String> allowedDomains = new ArrayList<>();
    /**
     * Pause after each mutating browser action, in seconds.
     */
    @Builder.Default
    private double waitBetweenActions = 0.5;
    private String userDataDir;
}
