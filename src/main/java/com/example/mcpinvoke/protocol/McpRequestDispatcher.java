package com.example.mcpinvoke.protocol;

import com.example.mcpinvoke.model.JsonRpcRequest;
import com.example.mcpinvoke.model.JsonRpcResponse;
import com.example.mcpinvoke.service.Futures;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public class McpRequestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(McpRequestDispatcher.class);

    private final McpServerContext context;
    private final McpErrorMapper errorMapper;
    private final ObjectMapper objectMapper;

    public McpRequestDispatcher(McpServerContext context, McpErrorMapper errorMapper, ObjectMapper objectMapper) {
        this.context = context;
        this.errorMapper = errorMapper;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<Optional<JsonRpcResponse>> dispatch(String payload) {
        JsonNode root;
        try {
            root = payload == null ? null : objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            log.debug("Rejecting malformed JSON-RPC payload: {}", ex.getOriginalMessage());
            return respond(null, ErrorKind.PARSE_ERROR, ex.getOriginalMessage());
        }
        if (root == null || root.isMissingNode()) {
            return respond(null, ErrorKind.PARSE_ERROR, "Empty request body");
        }
        if (!root.isObject()) {
            return respond(null, ErrorKind.INVALID_REQUEST, "Request must be a JSON object");
        }

        JsonNode idNode = root.get("id");
        if (idNode != null && !idNode.isNull() && !idNode.isTextual() && !idNode.isNumber()) {
            return respond(null, ErrorKind.INVALID_REQUEST, "id must be a string, number or null");
        }
        Object id = idValue(idNode);

        JsonNode jsonrpc = root.get("jsonrpc");
        if (jsonrpc == null || !"2.0".equals(jsonrpc.asText(null))) {
            return respond(id, ErrorKind.INVALID_REQUEST, "Only JSON-RPC 2.0 is supported");
        }
        JsonNode method = root.get("method");
        if (method == null || !method.isTextual() || method.asText().isBlank()) {
            return respond(id, ErrorKind.INVALID_REQUEST, "Missing method in request");
        }

        JsonRpcRequest request = new JsonRpcRequest("2.0", method.asText(), root.get("params"), idNode);
        return dispatch(request, id);
    }

    private CompletableFuture<Optional<JsonRpcResponse>> dispatch(JsonRpcRequest request, Object id) {
        log.debug("Dispatching {} (id={})", request.method(), id);
        CompletableFuture<?> result;
        try {
            result = route(request);
        } catch (RuntimeException ex) {
            result = CompletableFuture.failedFuture(ex);
        }

        CompletableFuture<Optional<JsonRpcResponse>> response = result.handle((value, failure) -> {
            if (request.isNotification()) {
                if (failure != null) {
                    log.debug("Notification {} failed: {}", request.method(), failure.getMessage());
                }
                return Optional.empty();
            }
            if (failure != null) {
                return Optional.of(JsonRpcResponse.failure(id, errorMapper.toError(failure)));
            }
            return Optional.of(JsonRpcResponse.success(id, value));
        });
        return Futures.propagateCancellation(response, result);
    }

    private CompletableFuture<?> route(JsonRpcRequest request) {
        return switch (request.method()) {
            case "initialize" -> CompletableFuture.completedFuture(handleInitialize());
            case "ping", "notifications/initialized" -> CompletableFuture.completedFuture(Map.of());
            case "tools/list" -> CompletableFuture.completedFuture(context.tools().listTools());
            case "tools/call" -> context.tools().callTool(request.params());
            default -> handleUnknownMethod(request);
        };
    }

    private CompletableFuture<?> handleUnknownMethod(JsonRpcRequest request) {
        if (context.legacyMethodDispatch() && context.tools().hasTool(request.method())) {
            JsonNode arguments = request.params();
            if (arguments == null || arguments.isNull()) {
                arguments = JsonNodeFactory.instance.objectNode();
            } else if (!arguments.isObject()) {
                throw new McpException(ErrorKind.INVALID_PARAMS, "params must be object");
            }
            return context.tools().invoke(request.method(), arguments);
        }
        throw new McpException(ErrorKind.METHOD_NOT_FOUND, request.method());
    }

    private Map<String, Object> handleInitialize() {
        return Map.of(
                "protocolVersion", McpServerContext.PROTOCOL_VERSION,
                "serverInfo", Map.of(
                        "name", context.serverName(),
                        "version", context.serverVersion()
                ),
                "capabilities", Map.of(
                        "tools", Map.of("listChanged", false)
                )
        );
    }

    private CompletableFuture<Optional<JsonRpcResponse>> respond(Object id, ErrorKind kind, String detail) {
        return CompletableFuture.completedFuture(Optional.of(
                JsonRpcResponse.failure(id, kind.code(), kind.message(detail), null)));
    }

    private static Object idValue(JsonNode idNode) {
        if (idNode == null || idNode.isNull()) {
            return null;
        }
        if (idNode.isTextual()) {
            return idNode.asText();
        }
        return idNode.numberValue();
    }
}
