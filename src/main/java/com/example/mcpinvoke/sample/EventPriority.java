package com.example.mcpinvoke.sample;

public enum EventPriority {
    LOW,
    NORMAL,
    HIGH
}
