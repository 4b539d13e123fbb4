package com.numbertrack.backend.modules.mobilenumber.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class MobileNumberStatusConverterTest {

    private final MobileNumberStatusConverter converter = new MobileNumberStatusConverter();

    @Test
    void storesTheLowerCaseApiToken() {
        assertThat(converter.convertToDatabaseColumn(MobileNumberStatus.PENDING_DEACTIVATION))
                .isEqualTo("pending_deactivation");
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
    }

    @Test
    void readsStoredTokensBack() {
        assertThat(converter.convertToEntityAttribute("user_reported")).isEqualTo(MobileNumberStatus.USER_REPORTED);
        assertThat(converter.convertToEntityAttribute(null)).isNull();
    }

    @Test
    void unknownColumnValueIsRejected() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute("retired"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
