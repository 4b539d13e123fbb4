package com.numbertrack.backend.modules.mobilenumber.presentation.dto;

import java.time.LocalDate;

/**
 * {@code reclaimDate} defaults to today when omitted.
 */
public record UnassignMobileNumberRequest(LocalDate reclaimDate) {
}
