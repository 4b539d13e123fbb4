package com.numbertrack.backend.modules.employee.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EmploymentStatus {
    ACTIVE("Active"),
    INACTIVE("Inactive"),
    DEPARTED("Departed");

    private final String value;

    EmploymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }

    @JsonCreator
    public static EmploymentStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown employment status: " + raw));
    }
}
