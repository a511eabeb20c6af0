package com.example.mcpinvoke.protocol;

public class McpException extends RuntimeException {
    private final ErrorKind kind;
    private final Object data;

    public McpException(ErrorKind kind, String detail) {
        this(kind, detail, null, null);
    }

    public McpException(ErrorKind kind, String detail, Object data) {
        this(kind, detail, data, null);
    }

    public McpException(ErrorKind kind, String detail, Object data, Throwable cause) {
        super(kind.message(detail), cause);
        this.kind = kind;
        this.data = data;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getCode() {
        return kind.code();
    }

    public Object getData() {
        return data;
    }
}
