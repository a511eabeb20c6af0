package com.example.mcpinvoke.schema;

import com.example.mcpinvoke.model.JsonType;
import com.example.mcpinvoke.model.ParameterInfo;
import com.example.mcpinvoke.model.ToolDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class JsonSchemaWriter {

    private JsonSchemaWriter() {
    }

    public static Map<String, Object> toolDescriptor(ToolDefinition definition) {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("name", definition.name());
        if (definition.description() != null) {
            descriptor.put("description", definition.description());
        }
        descriptor.put("inputSchema", inputSchema(definition.inputSchema()));
        return descriptor;
    }

    public static Map<String, Object> inputSchema(List<ParameterInfo> parameters) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ParameterInfo parameter : parameters) {
            properties.put(parameter.name(), node(parameter));
            if (parameter.required()) {
                required.add(parameter.name());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", JsonType.OBJECT.wireName());
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    static Map<String, Object> node(ParameterInfo info) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("type", info.type().wireName());
        if (info.description() != null) {
            node.put("description", info.description());
        }
        if (info.format() != null) {
            node.put("format", info.format());
        }
        if (info.source() != null) {
            node.put("source", info.source().wireName());
        }
        if (info.isEnum()) {
            node.put("enum", info.enumValues());
        }
        if (info.defaultValue() != null) {
            node.put("default", info.defaultValue());
        }
        if (info.items() != null) {
            node.put("items", node(info.items()));
        }
        if (info.properties() != null) {
            Map<String, Object> properties = new LinkedHashMap<>();
            info.properties().forEach((name, child) -> properties.put(name, node(child)));
            node.put("properties", properties);
            if (!info.requiredProperties().isEmpty()) {
                node.put("required", info.requiredProperties());
            }
        }
        return node;
    }
}
