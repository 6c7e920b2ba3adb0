package com.example.triangle.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChannelType {
    GROUP("group"),
    DM("dm");

    private final String value;

    ChannelType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
