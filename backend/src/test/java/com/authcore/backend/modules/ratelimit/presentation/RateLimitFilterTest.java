package com.authcore.backend.modules.ratelimit.presentation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.global.web.ClientAddressResolver;
import com.authcore.backend.global.web.ErrorResponseWriter;
import com.authcore.backend.modules.ratelimit.application.SlidingWindowRateLimiter;
import com.authcore.backend.support.InMemoryRevocationStore;
import com.authcore.backend.support.MutableClock;
import com.authcore.backend.support.TestAuthProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitFilterTest {

    private MutableClock clock;
    private InMemoryRevocationStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        store = new InMemoryRevocationStore(clock);
    }

    @Test
    void setsHeadersAndPassesAdmittedRequests() throws Exception {
        RateLimitFilter filter = filter(TestAuthProperties.rateLimit(2, Duration.ofMinutes(1), true));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(post("/api/v1/auth/login"), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("2");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("1");
    }

    @Test
    void rejectsOverLimitWithRetryAfterAndErrorBody() throws Exception {
        RateLimitFilter filter = filter(TestAuthProperties.rateLimit(2, Duration.ofMinutes(1), true));
        filter.doFilter(post("/api/v1/auth/register"), new MockHttpServletResponse(), new MockFilterChain());
        filter.doFilter(post("/api/v1/auth/login"), new MockHttpServletResponse(), new MockFilterChain());
        clock.advance(Duration.ofMillis(1500));

        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(post("/api/v1/auth/refresh"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("59");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("0");
        assertThat(response.getContentAsString()).contains("\"error\":\"rate_limited\"");
    }

    @Test
    void ignoresUnguardedEndpoints() throws Exception {
        RateLimitFilter filter = filter(TestAuthProperties.rateLimit(1, Duration.ofMinutes(1), true));
        MockHttpServletRequest me = new MockHttpServletRequest("GET", "/api/v1/auth/me");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(me, response, new MockFilterChain());
        filter.doFilter(new MockHttpServletRequest("GET", "/api/v1/auth/login"), response, new MockFilterChain());

        assertThat(response.getHeader("X-RateLimit-Limit")).isNull();
    }

    @Test
    void failsOpenWhenStoreIsDown() throws Exception {
        store.setUnavailable(true);
        RateLimitFilter filter = filter(TestAuthProperties.rateLimit(1, Duration.ofMinutes(1), true));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(post("/api/v1/auth/login"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void failsClosedWhenConfigured() throws Exception {
        store.setUnavailable(true);
        RateLimitFilter filter = filter(TestAuthProperties.rateLimit(1, Duration.ofMinutes(1), false));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(post("/api/v1/auth/login"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(503);
    }

    private RateLimitFilter filter(AuthProperties.RateLimit rateLimit) {
        AuthProperties properties = TestAuthProperties.withRateLimit(rateLimit);
        return new RateLimitFilter(
                new SlidingWindowRateLimiter(store, clock),
                new ClientAddressResolver(properties),
                new ErrorResponseWriter(new ObjectMapper()),
                properties
        );
    }

    private static MockHttpServletRequest post(String uri) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", uri);
        request.setRemoteAddr("192.0.2.10");
        return request;
    }
}
