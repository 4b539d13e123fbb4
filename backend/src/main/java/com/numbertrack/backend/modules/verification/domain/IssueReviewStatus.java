package com.numbertrack.backend.modules.verification.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueReviewStatus {
    PENDING_REVIEW("pending_review"),
    RESOLVED("resolved"),
    IGNORED("ignored");

    private final String value;

    IssueReviewStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isClosing() {
        return this == RESOLVED || this == IGNORED;
    }

    @JsonCreator
    public static IssueReviewStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(item -> item.value.equalsIgnoreCase(trimmed) || item.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown issue review status: " + raw));
    }
}
