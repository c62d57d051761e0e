package me.bantu.agent.domain.component;

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

import me.bantu.agent.domain.model.ToolDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool call arguments bound against a {@link ToolDefinition}'s input schema.
 *
 * <p>
 * Binding rejects unexpected names, missing required parameters, and values
 * whose JSON type does not match the declared {@code type}. A {@code null}
 * value counts as absent.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    private ToolArguments(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Validates the raw arguments against the definition.
     *
     * @throws ToolArgumentException
     *             if the arguments do not fit the declared parameters
     */
    @SuppressWarnings("unchecked")
    public static ToolArguments bind(ToolDefinition definition, Map<String, Object> raw) {
        Map<String, Object> args = raw != null ? raw : Map.of();
        Map<String, Object> properties = definition.getProperties();
        Map<String, Object> bound = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : args.entrySet()) {
            String name = entry.getKey();
            if (!properties.containsKey(name)) {
                throw new ToolArgumentException("unexpected argument '" + name + "'");
            }
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            Object schema = properties.get(name);
            String type = schema instanceof Map ? (String) ((Map<String, Object>) schema).get("type") : null;
            bound.put(name, coerce(name, type, value));
        }

        List<String> required = definition.getRequired();
        for (String name : required) {
            if (!bound.containsKey(name)) {
                throw new ToolArgumentException("missing required argument '" + name + "'");
            }
        }
        return new ToolArguments(bound);
    }

    private static Object coerce(String name, String type, Object value) {
        if (type == null) {
            return value;
        }
        Object coerced = switch (type) {
        case "string" -> value instanceof String ? value : null;
        case "integer" -> toIntegral(value);
        case "number" -> value instanceof Number ? value : null;
        case "boolean" -> value instanceof Boolean ? value : null;
        case "object" -> value instanceof Map ? value : null;
        case "array" -> value instanceof List ? value : null;
        default -> value;
        };
        if (coerced == null) {
            throw new ToolArgumentException("argument '" + name + "' must be of type " + type);
        }
        return coerced;
    }

    private static Long toIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d)) {
                return (long) d;
            }
        }
        return null;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value != null ? value.toString() : null;
    }

    public String getString(String name, String defaultValue) {
        String value = getString(name);
        return value != null ? value : defaultValue;
    }

    public long getLong(String name, long defaultValue) {
        Object value = values.get(name);
        return value instanceof Number number ? number.longValue() : defaultValue;
    }

    public int getInt(String name, int defaultValue) {
        long value = getLong(name, defaultValue);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ToolArgumentException("argument '" + name + "' is out of range");
        }
        return (int) value;
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = values.get(name);
        return value instanceof Boolean bool ? bool : defaultValue;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
