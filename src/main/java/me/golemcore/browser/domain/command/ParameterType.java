package me.golemcore.browser.domain.command;

/**
 * JSON types accepted for operation parameters.
 */
public enum ParameterType {
    STRING("string"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    NUMBER("number"),
    STRING_ARRAY("array");

    private final String jsonType;

    ParameterType(String jsonType) {
        this.jsonType = jsonType;
    }

    public String getJsonType() {
        return jsonType;
    }
}
