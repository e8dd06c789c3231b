package me.golemcore.browser.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class McpInvocationRequest {

    @JsonProperty("tool_name")
    @JsonAlias({ "toolName", "operation_name", "operationName" })
    private String toolName;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();
}
