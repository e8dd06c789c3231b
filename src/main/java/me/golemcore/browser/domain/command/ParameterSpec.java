package me.golemcore.browser.domain.command;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared shape of one operation parameter. Used both to validate incoming
 * parameters and to publish the JSON Schema of the operation.
 *
 * @param name
 *            wire name (snake_case)
 * @param type
 *            accepted JSON type
 * @param required
 *            whether the parameter must be present and non-null
 * @param allowBlank
 *            whether a required string may be empty or whitespace
 * @param defaultValue
 *            value applied when an optional parameter is absent, may be null
 * @param minimum
 *            inclusive lower bound for numeric parameters, may be null
 * @param allowedValues
 *            closed set for string parameters, empty when unrestricted
 * @param description
 *            human readable description
 */
public record ParameterSpec(
        String name,
        ParameterType type,
        boolean required,
        boolean allowBlank,
        Object defaultValue,
        Number minimum,
        List<String> allowedValues,
        String description) {

    public static ParameterSpec requiredString(String name, String description) {
        return new ParameterSpec(name, ParameterType.STRING, true, false, null, null, List.of(), description);
    }

    public static ParameterSpec requiredText(String name, String description) {
        return new ParameterSpec(name, ParameterType.STRING, true, true, null, null, List.of(), description);
    }

    public static ParameterSpec optionalString(String name, String defaultValue, String description) {
        return new ParameterSpec(name, ParameterType.STRING, false, false, defaultValue, null, List.of(),
                description);
    }

    public static ParameterSpec oneOf(String name, String defaultValue, List<String> values, String description) {
        return new ParameterSpec(name, ParameterType.STRING, false, false, defaultValue, null, List.copyOf(values),
                description);
    }

    public static ParameterSpec optionalBoolean(String name, boolean defaultValue, String description) {
        return new ParameterSpec(name, ParameterType.BOOLEAN, false, false, defaultValue, null, List.of(),
                description);
    }

    public static ParameterSpec requiredIndex(String name, String description) {
        return new ParameterSpec(name, ParameterType.INTEGER, true, false, null, 0, List.of(), description);
    }

    public static ParameterSpec optionalInteger(String name, int defaultValue, int minimum, String description) {
        return new ParameterSpec(name, ParameterType.INTEGER, false, false, defaultValue, minimum, List.of(),
                description);
    }

    public static ParameterSpec optionalNumber(String name, double defaultValue, double minimum,
            String description) {
        return new ParameterSpec(name, ParameterType.NUMBER, false, false, defaultValue, minimum, List.of(),
                description);
    }

    public static ParameterSpec stringList(String name, String description) {
        return new ParameterSpec(name, ParameterType.STRING_ARRAY, false, false, List.of(), null, List.of(),
                description);
    }

    Map<String, Object> toSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type.getJsonType());
        schema.put("description", description);
        if (type == ParameterType.STRING_ARRAY) {
            schema.put("items", Map.of("type", "string"));
        }
        if (!allowedValues.isEmpty()) {
            schema.put("enum", allowedValues);
        }
        if (minimum != null) {
            schema.put("minimum", minimum);
        }
        if (defaultValue != null) {
            schema.put("default", defaultValue);
        }
        return schema;
    }
}
