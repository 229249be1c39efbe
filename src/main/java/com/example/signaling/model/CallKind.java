package com.example.signaling.model;

import java.util.Arrays;
import java.util.Optional;

public enum CallKind {
    AUDIO("audio"),
    VIDEO("video"),
    SCREEN("screen");

    private final String value;

    CallKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<CallKind> fromValue(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.value.equalsIgnoreCase(value))
                .findFirst();
    }
}
