package com.numbertrack.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    @Test
    void keepsWellFormedCallerId() {
        assertThat(RequestIdFilter.resolveRequestId(" gw-7f3a:01 ")).isEqualTo("gw-7f3a:01");
    }

    @Test
    void replacesIdsThatCouldForgeLogLines() {
        String resolved = RequestIdFilter.resolveRequestId("abc\n2026-01-01 INFO fake");

        assertThat(UUID.fromString(resolved)).isNotNull();
    }

    @Test
    void echoesGeneratedIdAndLeavesMdcClean() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/verification/info");
        MockHttpServletResponse response = new MockHttpServletResponse();

        new RequestIdFilter().doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isNotBlank();
        assertThat(org.slf4j.MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }
}
