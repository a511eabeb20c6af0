package com.example.mcpinvoke.protocol;

import com.example.mcpinvoke.binding.BindingError;
import com.example.mcpinvoke.model.JsonRpcError;
import jakarta.validation.ConstraintViolationException;
import org.springframework.beans.TypeMismatchException;
import org.springframework.web.bind.MissingServletRequestParameterException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public class McpErrorMapper {

    private static final List<Class<? extends Throwable>> PARAMETER_FAILURES = List.of(
            IllegalArgumentException.class,
            ConstraintViolationException.class,
            TypeMismatchException.class,
            MissingServletRequestParameterException.class
    );

    public JsonRpcError toError(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof McpException mcp) {
            return new JsonRpcError(mcp.getCode(), mcp.getMessage(), mcp.getData());
        }
        if (cause instanceof CancellationException) {
            return error(ErrorKind.INTERNAL_ERROR, "Tool execution was cancelled", null);
        }
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (isParameterFailure(cause)) {
            return error(ErrorKind.INVALID_PARAMS, detail, null);
        }
        return error(ErrorKind.INTERNAL_ERROR, detail, null);
    }

    public JsonRpcError toError(BindingError bindingError) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("parameter", bindingError.path());
        data.put("expectedType", bindingError.expectedType());
        data.put("value", bindingError.value());
        data.put("reason", bindingError.reason().wireName());
        return error(ErrorKind.INVALID_PARAMS, bindingError.message(), data);
    }

    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current.getCause() != null && (current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof InvocationTargetException
                || current instanceof UndeclaredThrowableException)) {
            current = current.getCause();
        }
        return current;
    }

    public static boolean isParameterFailure(Throwable cause) {
        return PARAMETER_FAILURES.stream().anyMatch(type -> type.isInstance(cause));
    }

    private static JsonRpcError error(ErrorKind kind, String detail, Object data) {
        return new JsonRpcError(kind.code(), kind.message(detail), data);
    }
}
