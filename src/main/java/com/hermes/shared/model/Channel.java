package com.hermes.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Channel {
    EMAIL("email"),
    SMS("sms"),
    CHAT("chat");

    private final String wireName;

    Channel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Channel fromWire(String value) {
        for (var channel : values()) {
            if (channel.wireName.equalsIgnoreCase(value)) return channel;
        }
        throw new IllegalArgumentException("Unknown channel: " + value);
    }
}
