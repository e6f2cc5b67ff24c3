package com.tripmate.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void wellFormedIncomingIdIsPropagated() throws Exception {
        MockHttpServletRequest request = request();
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "  trace-0001.abc  ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> loggedId = new AtomicReference<>();
        AtomicReference<String> loggedIp = new AtomicReference<>();

        FilterChain chain = (req, res) -> {
            loggedId.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            loggedIp.set(MDC.get(RequestIdFilter.CLIENT_IP_MDC_KEY));
        };

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("trace-0001.abc");
        assertThat(RequestIdFilter.currentRequestId(request)).isEqualTo("trace-0001.abc");
        assertThat(loggedId.get()).isEqualTo("trace-0001.abc");
        assertThat(loggedIp.get()).isEqualTo("198.51.100.7");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
        assertThat(MDC.get(RequestIdFilter.CLIENT_IP_MDC_KEY)).isNull();
    }

    @Test
    void idCarryingLineBreaksIsReplaced() throws Exception {
        MockHttpServletRequest request = request();
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc12345\nINFO forged entry");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String assigned = response.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        assertThat(assigned).doesNotContain("forged").hasSize(36);
        assertThat(RequestIdFilter.currentRequestId(request)).isEqualTo(assigned);
    }

    @Test
    void missingIdIsGenerated() {
        assertThat(RequestIdFilter.acceptOrGenerate(null)).hasSize(36);
        assertThat(RequestIdFilter.acceptOrGenerate("short")).hasSize(36);
        assertThat(RequestIdFilter.acceptOrGenerate("x".repeat(65))).hasSize(36);
    }

    @Test
    void requestThatSkippedTheFilterHasNoId() {
        HttpServletRequest request = new MockHttpServletRequest();

        assertThat(RequestIdFilter.currentRequestId(request)).isNull();
    }

    private static MockHttpServletRequest request() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/auth/me");
        request.setRemoteAddr("198.51.100.7");
        return request;
    }
}
