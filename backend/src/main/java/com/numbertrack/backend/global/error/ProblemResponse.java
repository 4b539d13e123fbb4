package com.numbertrack.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * RFC 7807 body with the extra {@code code} member clients switch on.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String TYPE_NAMESPACE = "urn:numbertrack:problem:";

    public static String typeFor(String code) {
        return TYPE_NAMESPACE + code.toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String resolvedCode = (code == null || code.isBlank()) ? httpStatus.name() : code;
        String resolvedDetail = (detail == null || detail.isBlank()) ? httpStatus.getReasonPhrase() : detail;
        return new ProblemResponse(typeFor(resolvedCode), httpStatus.getReasonPhrase(), httpStatus.value(),
                resolvedDetail, instance, resolvedCode);
    }
}
