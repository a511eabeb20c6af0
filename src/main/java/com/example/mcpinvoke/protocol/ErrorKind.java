package com.example.mcpinvoke.protocol;

public enum ErrorKind {
    PARSE_ERROR(McpErrorCodes.PARSE_ERROR, "Parse error"),
    INVALID_REQUEST(McpErrorCodes.INVALID_REQUEST, "Invalid Request"),
    METHOD_NOT_FOUND(McpErrorCodes.METHOD_NOT_FOUND, "Method not found"),
    TOOL_NOT_FOUND(McpErrorCodes.TOOL_NOT_FOUND, "Tool not found"),
    INVALID_PARAMS(McpErrorCodes.INVALID_PARAMS, "Invalid params"),
    INTERNAL_ERROR(McpErrorCodes.INTERNAL_ERROR, "Internal error"),
    EXECUTION_FAILURE(McpErrorCodes.EXECUTION_FAILURE, "Server error");

    private final int code;
    private final String label;

    ErrorKind(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String message(String detail) {
        return detail == null || detail.isBlank() ? label : label + ": " + detail;
    }
}
