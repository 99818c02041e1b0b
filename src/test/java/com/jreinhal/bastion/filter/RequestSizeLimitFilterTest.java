package com.jreinhal.bastion.filter;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;

class RequestSizeLimitFilterTest {
    private final FilterChain okChain = (request, response) -> ((HttpServletResponse) response).setStatus(200);

    private RequestSizeLimitFilter filter() {
        RequestSizeLimitFilter filter = new RequestSizeLimitFilter(new ErrorResponseWriter(new ObjectMapper()));
        ReflectionTestUtils.setField(filter, "maxBodyBytes", 10240L);
        return filter;
    }

    @Test
    void bodyAtLimitPasses() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/chat");
        req.setContent(new byte[10240]);
        MockHttpServletResponse res = new MockHttpServletResponse();

        this.filter().doFilter(req, res, this.okChain);

        assertEquals(200, res.getStatus());
    }

    @Test
    void bodyOverLimitIs413() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/chat");
        req.setContent(new byte[10241]);
        MockHttpServletResponse res = new MockHttpServletResponse();

        this.filter().doFilter(req, res, this.okChain);

        assertEquals(413, res.getStatus());
        assertTrue(res.getContentAsString().contains("\"error\":\"payload_too_large\""));
    }

    @Test
    void missingContentLengthPasses() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/v1/usage");
        MockHttpServletResponse res = new MockHttpServletResponse();

        this.filter().doFilter(req, res, this.okChain);

        assertEquals(200, res.getStatus());
    }
}
