package com.example.mcpinvoke.model;

import java.lang.reflect.Method;
import java.util.List;

public record DiscoveredOperation(
        String toolName,
        String description,
        Class<?> handlerType,
        Method method,
        List<String> routeTemplates
) {
    public DiscoveredOperation {
        routeTemplates = routeTemplates == null ? List.of() : List.copyOf(routeTemplates);
    }
}
