package me.golemcore.browser.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Content of the active page as handed to the extraction capability: URL,
 * title, HTML, visible text and absolute link targets.
 */
@Data
@Builder
public class BrowserPage {

    private String url;
    private String title;
    private String html;
    private String text;
    private List<String> links;
}
