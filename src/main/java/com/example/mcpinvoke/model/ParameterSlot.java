package com.example.mcpinvoke.model;

import java.lang.reflect.Type;

public record ParameterSlot(
        int position,
        Type javaType,
        ParameterInfo schema
) {
    public boolean isInfrastructure() {
        return schema == null;
    }
}
