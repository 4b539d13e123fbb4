package com.numbertrack.backend.global.common;

import com.numbertrack.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Company numbers are 11 ASCII digits starting with {@code 1}.
 */
public final class PhoneNumberFormat {

    public static final int LENGTH = 11;
    public static final String PATTERN = "^1\\d{10}$";

    private PhoneNumberFormat() {
    }

    /**
     * @return the trimmed number
     * @throws ProblemException 400 {@code INVALID_PHONE_FORMAT} or {@code INVALID_PHONE_PREFIX}
     */
    public static String requireValid(String raw) {
        String phone = raw == null ? "" : raw.trim();
        if (phone.length() != LENGTH || !isAsciiDigits(phone)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_PHONE_FORMAT",
                    "phone number must be exactly %d digits".formatted(LENGTH));
        }
        if (phone.charAt(0) != '1') {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_PHONE_PREFIX",
                    "phone number must start with 1");
        }
        return phone;
    }

    private static boolean isAsciiDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
