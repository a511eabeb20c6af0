package com.example.mcpinvoke.service;

import com.example.mcpinvoke.binding.BindingResult;
import com.example.mcpinvoke.binding.ParameterBinder;
import com.example.mcpinvoke.model.JsonRpcError;
import com.example.mcpinvoke.model.RegisteredTool;
import com.example.mcpinvoke.protocol.ErrorKind;
import com.example.mcpinvoke.protocol.McpErrorMapper;
import com.example.mcpinvoke.protocol.McpException;
import com.example.mcpinvoke.schema.JsonSchemaWriter;
import com.example.mcpinvoke.tool.ToolRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class McpToolsService {
    private static final Logger log = LoggerFactory.getLogger(McpToolsService.class);

    private final ToolRegistry toolRegistry;
    private final ParameterBinder parameterBinder;
    private final ToolInvoker toolInvoker;
    private final McpErrorMapper errorMapper;

    public McpToolsService(ToolRegistry toolRegistry, ParameterBinder parameterBinder,
                           ToolInvoker toolInvoker, McpErrorMapper errorMapper) {
        this.toolRegistry = toolRegistry;
        this.parameterBinder = parameterBinder;
        this.toolInvoker = toolInvoker;
        this.errorMapper = errorMapper;
    }

    public Map<String, Object> listTools() {
        List<Map<String, Object>> tools = toolRegistry.list().stream()
                .map(tool -> JsonSchemaWriter.toolDescriptor(tool.definition()))
                .toList();
        return Map.of("tools", tools);
    }

    public CompletableFuture<Map<String, Object>> callTool(JsonNode params) {
        if (params == null || !params.isObject()) {
            throw new McpException(ErrorKind.INVALID_PARAMS, "tools/call requires params object");
        }

        JsonNode rawToolName = params.get("name");
        if (rawToolName == null || !rawToolName.isTextual() || rawToolName.asText().isBlank()) {
            throw new McpException(ErrorKind.INVALID_PARAMS, "tools/call requires non-empty name");
        }
        String toolName = rawToolName.asText();

        JsonNode arguments = params.get("arguments");
        if (arguments == null || arguments.isNull()) {
            arguments = JsonNodeFactory.instance.objectNode();
        } else if (!arguments.isObject()) {
            throw new McpException(ErrorKind.INVALID_PARAMS, "tools/call arguments must be object");
        }

        RegisteredTool tool = toolRegistry.findByName(toolName)
                .orElseThrow(() -> new McpException(ErrorKind.TOOL_NOT_FOUND, toolName));
        return invoke(tool, arguments);
    }

    public boolean hasTool(String name) {
        return toolRegistry.findByName(name).isPresent();
    }

    public CompletableFuture<Map<String, Object>> invoke(RegisteredTool tool, JsonNode arguments) {
        BindingResult binding = parameterBinder.bind(tool, arguments);
        if (!binding.isSuccess()) {
            log.debug("Binding arguments for tool {} failed: {}", tool.name(), binding.error().message());
            JsonRpcError error = errorMapper.toError(binding.error());
            return CompletableFuture.failedFuture(
                    new McpException(ErrorKind.INVALID_PARAMS, binding.error().message(), error.data()));
        }
        return toolInvoker.invoke(tool, binding.arguments());
    }

    public CompletableFuture<Map<String, Object>> invoke(String toolName, JsonNode arguments) {
        RegisteredTool tool = toolRegistry.findByName(toolName)
                .orElseThrow(() -> new McpException(ErrorKind.TOOL_NOT_FOUND, toolName));
        return invoke(tool, arguments);
    }
}
