package com.example.mcpinvoke.binding;

import com.fasterxml.jackson.annotation.JsonValue;

public record BindingError(
        Reason reason,
        String path,
        String expectedType,
        Object value,
        String message
) {

    public static BindingError missingRequired(String path, String expectedType) {
        return new BindingError(Reason.MISSING_REQUIRED, path, expectedType, null,
                "Missing required parameter '" + path + "'");
    }

    public static BindingError typeMismatch(String path, String expectedType, Object value) {
        return new BindingError(Reason.TYPE_MISMATCH, path, expectedType, value,
                "Parameter '" + path + "' expects " + expectedType + " but got " + value);
    }

    public static BindingError enumViolation(String path, String expectedType, Object value, Object allowed) {
        return new BindingError(Reason.ENUM_VIOLATION, path, expectedType, value,
                "Parameter '" + path + "' must be one of " + allowed + " but got " + value);
    }

    public enum Reason {
        MISSING_REQUIRED("missing_required"),
        TYPE_MISMATCH("type_mismatch"),
        ENUM_VIOLATION("enum_violation");

        private final String wireName;

        Reason(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }
}
