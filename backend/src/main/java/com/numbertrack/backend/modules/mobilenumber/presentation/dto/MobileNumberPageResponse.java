package com.numbertrack.backend.modules.mobilenumber.presentation.dto;

import java.util.List;

public record MobileNumberPageResponse(List<MobileNumberResponse> items, int page, int size, long totalCount) {
}
