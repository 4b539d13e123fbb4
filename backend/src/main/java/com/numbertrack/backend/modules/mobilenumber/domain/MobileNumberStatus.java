package com.numbertrack.backend.modules.mobilenumber.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MobileNumberStatus {
    IDLE("idle"),
    IN_USE("in_use"),
    PENDING_DEACTIVATION("pending_deactivation"),
    DEACTIVATED("deactivated"),
    RISK_PENDING("risk_pending"),
    USER_REPORTED("user_reported");

    private final String value;

    MobileNumberStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Flagged states keep the current holder until an admin resolves them.
     */
    public boolean isFlagged() {
        return this == RISK_PENDING || this == USER_REPORTED;
    }

    @JsonCreator
    public static MobileNumberStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown mobile number status: " + raw));
    }
}
