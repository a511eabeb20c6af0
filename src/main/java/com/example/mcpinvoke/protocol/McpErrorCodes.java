package com.example.mcpinvoke.protocol;

public final class McpErrorCodes {
    private McpErrorCodes() {
    }

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int TOOL_NOT_FOUND = METHOD_NOT_FOUND;
    public static final int EXECUTION_FAILURE = -32000;
}
