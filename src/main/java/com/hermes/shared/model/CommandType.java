package com.hermes.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CommandType {
    EDIT,
    BUILD,
    COMMIT,
    PUSH,
    PREVIEW,
    INTERRUPT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CommandType fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
