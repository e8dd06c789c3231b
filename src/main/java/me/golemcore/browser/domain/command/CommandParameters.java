/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.browser.domain.command;

import me.golemcore.browser.domain.exception.OrchestrationException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of one operation call after validation against its
 * {@link ParameterSpec}s.
 *
 * <p>
 * Validation is strict about types: a boolean parameter only accepts a JSON
 * boolean, an integer parameter only accepts an integral number. Absent and
 * {@code null} values are treated the same; optional parameters then take
 * their declared default. Keys not declared by the operation are ignored.
 */
public final class CommandParameters {

    private final BrowserOperation operation;
    private final Map<String, Object> values;

    private CommandParameters(BrowserOperation operation, Map<String, Object> values) {
        this.operation = operation;
        this.values = values;
    }

    /**
     * Validates {@code raw} for {@code operation}, failing with
     * {@code INVALID_PARAMETERS} on the first offending parameter.
     */
    public static CommandParameters validate(BrowserOperation operation, Map<String, ?> raw) {
        Map<String, ?> input = raw != null ? raw : Collections.emptyMap();
        Map<String, Object> values = new HashMap<>();
        for (ParameterSpec spec : operation.getParameters()) {
            Object value = input.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    throw OrchestrationException.invalidParameters(
                            "Missing required parameter '" + spec.name() + "' for " + operation.getName());
                }
                if (spec.defaultValue() != null) {
                    values.put(spec.name(), spec.defaultValue());
                }
                continue;
            }
            values.put(spec.name(), coerce(operation, spec, value));
        }
        return new CommandParameters(operation, values);
    }

    public BrowserOperation getOperation() {
        return operation;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public String getString(String name) {
        return (String) values.get(name);
    }

    public boolean getBoolean(String name) {
        Object value = values.get(name);
        return value != null && (Boolean) value;
    }

    public int getInt(String name) {
        Object value = values.get(name);
        return value != null ? ((Number) value).intValue() : 0;
    }

    public double getDouble(String name) {
        Object value = values.get(name);
        return value != null ? ((Number) value).doubleValue() : 0.0;
    }

    @SuppressWarnings("unchecked")
    public List<String> getStringList(String name) {
        Object value = values.get(name);
        return value != null ? (List<String>) value : List.of();
    }

    private static Object coerce(BrowserOperation operation, ParameterSpec spec, Object value) {
        return switch (spec.type()) {
        case STRING -> coerceString(operation, spec, value);
        case BOOLEAN -> coerceBoolean(operation, spec, value);
        case INTEGER -> coerceInteger(operation, spec, value);
        case NUMBER -> coerceNumber(operation, spec, value);
        case STRING_ARRAY -> coerceStringList(operation, spec, value);
        };
    }

    private static Boolean coerceBoolean(BrowserOperation operation, ParameterSpec spec, Object value) {
        if (!(value instanceof Boolean)) {
            throw typeMismatch(operation, spec, "a boolean");
        }
        return (Boolean) value;
    }

    private static String coerceString(BrowserOperation operation, ParameterSpec spec, Object value) {
        if (!(value instanceof String)) {
            throw typeMismatch(operation, spec, "a string");
        }
        String text = (String) value;
        if (spec.required() && !spec.allowBlank() && text.isBlank()) {
            throw OrchestrationException.invalidParameters(
                    "Parameter '" + spec.name() + "' must not be blank");
        }
        if (!spec.allowedValues().isEmpty() && !spec.allowedValues().contains(text)) {
            throw OrchestrationException.invalidParameters("Parameter '" + spec.name() + "' must be one of "
                    + spec.allowedValues() + ", got '" + text + "'");
        }
        return text;
    }

    private static Integer coerceInteger(BrowserOperation operation, ParameterSpec spec, Object value) {
        if (!(value instanceof Number) || !isIntegral((Number) value)) {
            throw typeMismatch(operation, spec, "an integer");
        }
        long number = ((Number) value).longValue();
        if (number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
            throw OrchestrationException.invalidParameters("Parameter '" + spec.name() + "' is out of range");
        }
        if (spec.minimum() != null && number < spec.minimum().longValue()) {
            throw OrchestrationException.invalidParameters(
                    "Parameter '" + spec.name() + "' must be >= " + spec.minimum());
        }
        return (int) number;
    }

    private static Double coerceNumber(BrowserOperation operation, ParameterSpec spec, Object value) {
        if (!(value instanceof Number)) {
            throw typeMismatch(operation, spec, "a number");
        }
        double number = ((Number) value).doubleValue();
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw typeMismatch(operation, spec, "a finite number");
        }
        if (spec.minimum() != null && number < spec.minimum().doubleValue()) {
            throw OrchestrationException.invalidParameters(
                    "Parameter '" + spec.name() + "' must be >= " + spec.minimum());
        }
        return number;
    }

    private static List<String> coerceStringList(BrowserOperation operation, ParameterSpec spec, Object value) {
        if (!(value instanceof List<?>)) {
            throw typeMismatch(operation, spec, "an array of strings");
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                throw typeMismatch(operation, spec, "an array of strings");
            }
            result.add((String) item);
        }
        return Collections.unmodifiableList(result);
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte) {
            return true;
        }
        if (number instanceof BigInteger) {
            return true;
        }
        double asDouble = number.doubleValue();
        return !Double.isInfinite(asDouble) && asDouble == Math.rint(asDouble);
    }

    private static OrchestrationException typeMismatch(BrowserOperation operation, ParameterSpec spec,
            String expected) {
        return OrchestrationException.invalidParameters("Parameter '" + spec.name() + "' of "
                + operation.getName() + " must be " + expected);
    }
}
