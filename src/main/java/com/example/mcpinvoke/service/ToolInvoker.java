package com.example.mcpinvoke.service;

import com.example.mcpinvoke.model.RegisteredTool;
import com.example.mcpinvoke.protocol.ErrorKind;
import com.example.mcpinvoke.protocol.McpErrorMapper;
import com.example.mcpinvoke.protocol.McpException;
import com.example.mcpinvoke.tool.HandlerResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.http.HttpEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.util.ReflectionUtils;
import org.springframework.web.context.request.async.DeferredResult;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

public class ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(ToolInvoker.class);

    private final HandlerResolver handlerResolver;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public ToolInvoker(HandlerResolver handlerResolver, ObjectMapper objectMapper, Executor executor) {
        this.handlerResolver = handlerResolver;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    public CompletableFuture<Map<String, Object>> invoke(RegisteredTool tool, Object[] arguments) {
        Object returned;
        try {
            returned = call(tool, arguments);
        } catch (Exception ex) {
            return CompletableFuture.failedFuture(hostFailure(tool, ex));
        }

        CompletableFuture<Object> hostFuture = toFuture(returned);
        CompletableFuture<Map<String, Object>> response = hostFuture
                .handle((value, failure) -> {
                    if (failure != null) {
                        throw new CompletionException(hostFailure(tool, failure));
                    }
                    return toContent(value);
                });
        return Futures.propagateCancellation(response, hostFuture);
    }

    private Object call(RegisteredTool tool, Object[] arguments) throws Exception {
        Object target = null;
        Method method = tool.method();
        if (!tool.isStatic()) {
            target = handlerResolver.resolve(tool.handlerType());
            method = AopUtils.selectInvocableMethod(method, target.getClass());
        }
        ReflectionUtils.makeAccessible(method);
        log.debug("Invoking tool {} -> {}", tool.name(), method.toGenericString());
        return method.invoke(target, arguments);
    }

    @SuppressWarnings("unchecked")
    private CompletableFuture<Object> toFuture(Object returned) {
        if (returned instanceof CompletionStage<?> stage) {
            return (CompletableFuture<Object>) (CompletableFuture<?>) stage.toCompletableFuture();
        }
        if (returned instanceof Callable<?> callable) {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return callable.call();
                } catch (Exception ex) {
                    throw new CompletionException(ex);
                }
            }, executor);
        }
        if (returned instanceof DeferredResult<?> deferred) {
            CompletableFuture<Object> future = new CompletableFuture<>();
            deferred.setResultHandler(value -> {
                if (value instanceof Throwable failure) {
                    future.completeExceptionally(failure);
                } else {
                    future.complete(value);
                }
            });
            return future;
        }
        return CompletableFuture.completedFuture(returned);
    }

    private Map<String, Object> toContent(Object value) {
        Object payload = unwrap(value);
        String text;
        try {
            text = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new McpException(ErrorKind.INTERNAL_ERROR, "Failed to serialize tool result", null, ex);
        }
        return Map.of("content", List.of(Map.of("type", "text", "text", text)));
    }

    private static Object unwrap(Object value) {
        Object current = value;
        while (true) {
            if (current instanceof ResponseEntity<?> entity) {
                if (!entity.getStatusCode().is2xxSuccessful()) {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("status", entity.getStatusCode().value());
                    data.put("body", entity.getBody());
                    throw new McpException(ErrorKind.EXECUTION_FAILURE,
                            "Request failed with status " + entity.getStatusCode().value(), data);
                }
                current = entity.getBody();
            } else if (current instanceof HttpEntity<?> entity) {
                current = entity.getBody();
            } else if (current instanceof Optional<?> optional) {
                current = optional.orElse(null);
            } else {
                return current;
            }
        }
    }

    private static Throwable hostFailure(RegisteredTool tool, Throwable failure) {
        Throwable cause = McpErrorMapper.unwrap(failure);
        if (cause instanceof CancellationException) {
            log.debug("Tool {} was cancelled", tool.name());
        } else if (cause instanceof McpException || McpErrorMapper.isParameterFailure(cause)) {
            log.warn("Tool {} rejected the call: {}", tool.name(), cause.getMessage());
        } else {
            log.error("Tool {} failed", tool.name(), cause);
        }
        return cause;
    }
}
