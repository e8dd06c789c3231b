package me.golemcore.browser.domain.command;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Published description of an operation: name, routing class and JSON Schema
 * of its parameters.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OperationDefinition {

    private String name;
    private String description;
    private OperationClass operationClass;
    private Map<String, Object> inputSchema; // JSON Schema
}
