package com.example.mcpinvoke.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParameterSource {
    ROUTE("route"),
    QUERY("query"),
    BODY("body"),
    HEADER("header"),
    FORM("form");

    private final String wireName;

    ParameterSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
