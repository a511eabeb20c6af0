package com.example.mcpinvoke.controller;

import com.example.mcpinvoke.model.JsonRpcResponse;
import com.example.mcpinvoke.protocol.ErrorKind;
import com.example.mcpinvoke.protocol.McpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(assignableTypes = McpController.class)
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(McpException.class)
    @ResponseStatus(HttpStatus.OK)
    public JsonRpcResponse handleMcpException(McpException ex) {
        return JsonRpcResponse.failure(null, ex.getCode(), ex.getMessage(), ex.getData());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.OK)
    public JsonRpcResponse handleInvalidJson(HttpMessageNotReadableException ex) {
        log.debug("Unreadable MCP request: {}", ex.getMessage());
        return JsonRpcResponse.failure(null, ErrorKind.PARSE_ERROR.code(),
                ErrorKind.PARSE_ERROR.message("Invalid JSON payload"), null);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.OK)
    public JsonRpcResponse handleUnhandledException(Exception ex) {
        log.error("Unhandled error on MCP endpoint", ex);
        return JsonRpcResponse.failure(null, ErrorKind.INTERNAL_ERROR.code(),
                ErrorKind.INTERNAL_ERROR.message("Internal server error"), null);
    }
}
