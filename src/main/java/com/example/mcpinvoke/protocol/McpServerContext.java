package com.example.mcpinvoke.protocol;

import com.example.mcpinvoke.service.McpToolsService;

public record McpServerContext(
        String serverName,
        String serverVersion,
        McpToolsService tools,
        boolean legacyMethodDispatch
) {
    public static final String PROTOCOL_VERSION = "2025-06-18";
}
