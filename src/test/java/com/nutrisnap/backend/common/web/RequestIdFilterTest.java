package com.nutrisnap.backend.common.web;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void inbound_id_is_echoed_and_visible_in_mdc_during_chain() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/food-recognition");
        req.addHeader(RequestIdFilter.HEADER, "gw-7f3a:01");
        MockHttpServletResponse res = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(req, res, (rq, rs) -> seen.set(MDC.get(RequestIdFilter.MDC_KEY)));

        assertThat(seen.get()).isEqualTo("gw-7f3a:01");
        assertThat(res.getHeader(RequestIdFilter.HEADER)).isEqualTo("gw-7f3a:01");
        assertThat(req.getAttribute(RequestIdFilter.ATTR)).isEqualTo("gw-7f3a:01");
        assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isNull();
    }

    @Test
    void unsafe_or_oversized_inbound_id_is_replaced() {
        assertThat(RequestIdFilter.resolve("abc\r\nX-Evil: 1")).isNotEqualTo("abc\r\nX-Evil: 1").hasSize(36);
        assertThat(RequestIdFilter.resolve("a".repeat(129))).hasSize(36);
        assertThat(RequestIdFilter.resolve("   ")).hasSize(36);
        assertThat(RequestIdFilter.resolve(null)).hasSize(36);
        assertThat(RequestIdFilter.resolve(" req-1 ")).isEqualTo("req-1");
    }

    @Test
    void outer_mdc_value_is_restored_after_chain() throws Exception {
        MDC.put(RequestIdFilter.MDC_KEY, "outer");
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/v1/meals");

        filter.doFilter(req, new MockHttpServletResponse(), (rq, rs) -> { });

        assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isEqualTo("outer");
    }

    @Test
    void get_or_create_remembers_the_minted_id() {
        MockHttpServletRequest req = new MockHttpServletRequest();

        String first = RequestIdFilter.getOrCreate(req);

        assertThat(RequestIdFilter.getOrCreate(req)).isEqualTo(first);
    }
}
