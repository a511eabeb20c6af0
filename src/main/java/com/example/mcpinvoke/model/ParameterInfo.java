package com.example.mcpinvoke.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema node describing a tool parameter, or a property/item nested inside one.
 *
 * <p>{@code required} only matters for top-level parameters. Nested objects express required-ness
 * through {@code requiredProperties}, which is what gets rendered as the JSON Schema
 * {@code required} array.
 *
 * <p>{@code enumNames} holds the Java constant names aligned index by index with
 * {@code enumValues}. It is used while binding and is never rendered.
 */
public record ParameterInfo(
        String name,
        JsonType type,
        boolean required,
        String description,
        ParameterSource source,
        Map<String, ParameterInfo> properties,
        List<String> requiredProperties,
        ParameterInfo items,
        List<Object> enumValues,
        List<String> enumNames,
        String format,
        Object defaultValue
) {
    public ParameterInfo {
        if (type == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' has no type");
        }
        if (type == JsonType.ARRAY && items == null) {
            throw new IllegalArgumentException("Array parameter '" + name + "' requires an items schema");
        }
        properties = properties == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        requiredProperties = requiredProperties == null ? List.of() : List.copyOf(requiredProperties);
        enumValues = enumValues == null ? null : Collections.unmodifiableList(new ArrayList<>(enumValues));
        enumNames = enumNames == null ? null : List.copyOf(enumNames);
    }

    public static Builder builder(String name, JsonType type) {
        return new Builder(name, type);
    }

    public boolean isEnum() {
        return enumValues != null && !enumValues.isEmpty();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(name, type)
                .required(required)
                .description(description)
                .source(source)
                .items(items)
                .format(format)
                .defaultValue(defaultValue);
        builder.properties = properties == null ? null : new LinkedHashMap<>(properties);
        builder.requiredProperties = new ArrayList<>(requiredProperties);
        builder.enumValues = enumValues == null ? null : new ArrayList<>(enumValues);
        builder.enumNames = enumNames == null ? null : new ArrayList<>(enumNames);
        return builder;
    }

    public static final class Builder {
        private String name;
        private final JsonType type;
        private boolean required;
        private String description;
        private ParameterSource source;
        private Map<String, ParameterInfo> properties;
        private List<String> requiredProperties = new ArrayList<>();
        private ParameterInfo items;
        private List<Object> enumValues;
        private List<String> enumNames;
        private String format;
        private Object defaultValue;

        private Builder(String name, JsonType type) {
            this.name = name;
            this.type = type;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder source(ParameterSource source) {
            this.source = source;
            return this;
        }

        public Builder properties(Map<String, ParameterInfo> properties) {
            this.properties = properties;
            return this;
        }

        public Builder requiredProperties(List<String> requiredProperties) {
            this.requiredProperties = requiredProperties;
            return this;
        }

        public Builder items(ParameterInfo items) {
            this.items = items;
            return this;
        }

        public Builder enumeration(List<Object> values, List<String> names) {
            this.enumValues = values;
            this.enumNames = names;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public ParameterInfo build() {
            return new ParameterInfo(name, type, required, description, source, properties,
                    requiredProperties, items, enumValues, enumNames, format, defaultValue);
        }
    }
}
