package com.example.mcpinvoke.tool;

import com.example.mcpinvoke.model.DiscoveredOperation;

import java.util.List;

public interface ToolDefinitionSource {

    List<DiscoveredOperation> discover();
}
