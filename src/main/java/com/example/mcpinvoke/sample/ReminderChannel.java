package com.example.mcpinvoke.sample;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReminderChannel {
    NONE(0),
    EMAIL(1),
    SMS(2),
    PUSH(3);

    private final int code;

    ReminderChannel(int code) {
        this.code = code;
    }

    @JsonValue
    public int code() {
        return code;
    }

    @JsonCreator
    public static ReminderChannel fromCode(int code) {
        for (ReminderChannel channel : values()) {
            if (channel.code == code) {
                return channel;
            }
        }
        throw new IllegalArgumentException("Unknown reminder channel code: " + code);
    }
}
