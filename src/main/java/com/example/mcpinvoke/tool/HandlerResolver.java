package com.example.mcpinvoke.tool;

public interface HandlerResolver {

    Object resolve(Class<?> handlerType);
}
