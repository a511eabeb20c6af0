package com.example.mcpinvoke.model;

import java.util.List;

public record ToolDefinition(
        String name,
        String description,
        List<ParameterInfo> inputSchema
) {
    public ToolDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        inputSchema = inputSchema == null ? List.of() : List.copyOf(inputSchema);
    }
}
