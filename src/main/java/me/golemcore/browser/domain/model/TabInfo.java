package me.golemcore.browser.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One tab of a session. The index is the zero-based position at the time the
 * tab list was read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TabInfo {
    private int index;
    private String url;
    private String title;
    private boolean active;
}
