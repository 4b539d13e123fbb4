package com.numbertrack.backend.modules.verification.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportedIssueType {
    NUMBER_ISSUE("number_issue"),
    UNLISTED_NUMBER("unlisted_number");

    private final String value;

    ReportedIssueType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ReportedIssueType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(item -> item.value.equalsIgnoreCase(trimmed) || item.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown reported issue type: " + raw));
    }
}
