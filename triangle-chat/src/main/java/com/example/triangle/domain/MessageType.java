package com.example.triangle.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum MessageType {
    TEXT("text"),
    SYSTEM("system"),
    CODE("code");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Looks up a type by its wire tag, case-insensitively. Unknown tags yield an empty result.
     */
    public static Optional<MessageType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MessageType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static MessageType fromJson(String value) {
        return fromValue(value).orElseThrow(() -> new IllegalArgumentException("Unknown message type: " + value));
    }
}
