package com.numbertrack.backend.modules.mobilenumber.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link MobileNumberStatus} as its lower-case token ({@code in_use}), the same value the API uses.
 */
@Converter
public class MobileNumberStatusConverter implements AttributeConverter<MobileNumberStatus, String> {

    @Override
    public String convertToDatabaseColumn(MobileNumberStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public MobileNumberStatus convertToEntityAttribute(String column) {
        return column == null ? null : MobileNumberStatus.fromValue(column);
    }
}
