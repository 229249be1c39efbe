package com.example.signaling.model;

import java.util.Arrays;
import java.util.Optional;

public enum PresenceStatus {
    ONLINE("online"),
    OFFLINE("offline");

    private final String value;

    PresenceStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<PresenceStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst();
    }
}
