package com.example.mcpinvoke.tool;

import com.example.mcpinvoke.model.DiscoveredOperation;
import com.example.mcpinvoke.model.RegisteredTool;
import com.example.mcpinvoke.schema.SchemaGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, RegisteredTool> toolMap;

    public ToolRegistry(Collection<RegisteredTool> tools) {
        Map<String, RegisteredTool> byName = new LinkedHashMap<>();
        for (RegisteredTool tool : tools) {
            RegisteredTool previous = byName.putIfAbsent(tool.name(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name '" + tool.name() + "': "
                        + previous.method().toGenericString() + " and " + tool.method().toGenericString());
            }
        }
        this.toolMap = Collections.unmodifiableMap(byName);
    }

    public static ToolRegistry build(List<DiscoveredOperation> operations, SchemaGenerator generator) {
        List<RegisteredTool> tools = new ArrayList<>(operations.size());
        for (DiscoveredOperation operation : operations) {
            try {
                tools.add(generator.generate(operation));
            } catch (RuntimeException ex) {
                log.warn("Skipping tool {}: schema generation failed for {}", operation.toolName(),
                        operation.method().toGenericString(), ex);
            }
        }
        ToolRegistry registry = new ToolRegistry(tools);
        log.info("Registered {} MCP tool(s): {}", registry.size(), registry.toolMap.keySet());
        return registry;
    }

    public List<RegisteredTool> list() {
        return List.copyOf(toolMap.values());
    }

    public Optional<RegisteredTool> findByName(String name) {
        return Optional.ofNullable(toolMap.get(name));
    }

    public int size() {
        return toolMap.size();
    }
}
