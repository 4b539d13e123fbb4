package com.numbertrack.backend.modules.verification.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum VerificationActionType {
    CONFIRM_USAGE("confirm_usage"),
    REPORT_ISSUE("report_issue"),
    REPORT_UNLISTED("report_unlisted");

    private final String value;

    VerificationActionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static VerificationActionType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(item -> item.value.equalsIgnoreCase(trimmed) || item.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown verification action type: " + raw));
    }
}
