package com.example.mcpinvoke.model;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;

public record RegisteredTool(
        ToolDefinition definition,
        Class<?> handlerType,
        Method method,
        List<ParameterSlot> slots
) {
    public RegisteredTool {
        slots = List.copyOf(slots);
    }

    public String name() {
        return definition.name();
    }

    public boolean isStatic() {
        return Modifier.isStatic(method.getModifiers());
    }
}
