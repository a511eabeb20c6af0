package com.example.mcpinvoke.binding;

public record BindingResult(Object[] arguments, BindingError error) {

    public static BindingResult success(Object[] arguments) {
        return new BindingResult(arguments, null);
    }

    public static BindingResult failure(BindingError error) {
        return new BindingResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
