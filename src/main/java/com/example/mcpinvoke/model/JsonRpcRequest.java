package com.example.mcpinvoke.model;

import com.fasterxml.jackson.databind.JsonNode;

public record JsonRpcRequest(
        String jsonrpc,
        String method,
        JsonNode params,
        JsonNode id
) {
    public boolean isNotification() {
        return id == null || id.isNull();
    }
}
