package com.numbertrack.backend.modules.mobilenumber.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskAction {
    CHANGE_APPLICANT("change_applicant"),
    RECLAIM("reclaim"),
    DEACTIVATE("deactivate");

    private final String value;

    RiskAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RiskAction fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(action -> action.value.equalsIgnoreCase(raw.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown risk action: " + raw));
    }
}
