package com.example.mcpinvoke.controller;

import com.example.mcpinvoke.annotation.McpExclude;
import com.example.mcpinvoke.model.JsonRpcResponse;
import com.example.mcpinvoke.protocol.McpRequestDispatcher;
import com.example.mcpinvoke.service.Futures;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@RestController
@McpExclude
@RequestMapping(path = "${mcp.invoke.path:/mcp}")
public class McpController {
    private final McpRequestDispatcher dispatcher;

    public McpController(McpRequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<JsonRpcResponse>> handleHttp(@RequestBody String payload) {
        CompletableFuture<Optional<JsonRpcResponse>> dispatched = dispatcher.dispatch(payload);
        CompletableFuture<ResponseEntity<JsonRpcResponse>> response = dispatched.thenApply(result -> result
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.ACCEPTED).build()));
        return Futures.propagateCancellation(response, dispatched);
    }
}
