package me.golemcore.browser.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Snapshot of the active tab: location, open tabs, indexed interactive
 * elements and an optional base64 PNG screenshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BrowserState {
    private String url;
    private String title;
    private List<TabInfo> tabs;
    private List<InteractiveElement> interactiveElements;
    private String screenshot;
}
