package com.mlbbai.hero_analysis_engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlbbai.hero_analysis_engine.config.HeroEngineProperties;
import com.mlbbai.hero_analysis_engine.service.ClientRequestRateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ClientRateLimitFilterTest {

    private HeroEngineProperties properties;
    private ClientRateLimitFilter filter;

    @BeforeEach
    void setUp() {
        properties = new HeroEngineProperties();
        properties.getRateLimit().setMaxRequests(1);
        properties.getRateLimit().setWindow(Duration.ofMinutes(15));
        filter = newFilter();
    }

    private ClientRateLimitFilter newFilter() {
        ClientRequestRateLimiter limiter = new ClientRequestRateLimiter(properties);
        return new ClientRateLimitFilter(limiter, new ObjectMapper(), properties);
    }

    private MockHttpServletResponse call(String uri) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
        request.setRemoteAddr("203.0.113.7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    @Test
    void requestOverBudgetIsRejectedWithRetryAfter() throws Exception {
        MockHttpServletResponse first = call("/api/heroes");
        MockHttpServletResponse second = call("/api/heroes");

        assertThat(first.getStatus()).isEqualTo(200);
        assertThat(first.getHeader("X-RateLimit-Remaining")).isEqualTo("0");
        assertThat(second.getStatus()).isEqualTo(429);
        assertThat(Long.parseLong(second.getHeader("Retry-After"))).isBetween(890L, 900L);
        assertThat(second.getContentAsString()).contains("\"error\":\"Too many requests\"");
    }

    @Test
    void nonApiRoutesAreNotLimited() throws Exception {
        call("/api/heroes");

        assertThat(call("/actuator/health").getStatus()).isEqualTo(200);
        assertThat(call("/").getStatus()).isEqualTo(200);
    }

    @Test
    void disabledLimiterPassesEverything() throws Exception {
        properties.getRateLimit().setEnabled(false);
        filter = newFilter();

        call("/api/heroes");

        assertThat(call("/api/heroes").getStatus()).isEqualTo(200);
    }
}
