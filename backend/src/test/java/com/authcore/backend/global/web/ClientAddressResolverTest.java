package com.authcore.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.support.TestAuthProperties;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientAddressResolverTest {

    @Test
    void usesFirstForwardedHopWhenTrusted() {
        ClientAddressResolver resolver = resolver(true);
        MockHttpServletRequest request = request();
        request.addHeader("X-Forwarded-For", " 203.0.113.5 , 10.0.0.2");

        assertThat(resolver.resolve(request)).isEqualTo("203.0.113.5");
    }

    @Test
    void fallsBackToRealIpThenRemoteAddress() {
        ClientAddressResolver resolver = resolver(true);
        MockHttpServletRequest withRealIp = request();
        withRealIp.addHeader("X-Real-IP", "203.0.113.9");

        assertThat(resolver.resolve(withRealIp)).isEqualTo("203.0.113.9");
        assertThat(resolver.resolve(request())).isEqualTo("192.0.2.10");
    }

    @Test
    void ignoresForwardingHeadersWhenNotTrusted() {
        MockHttpServletRequest request = request();
        request.addHeader("X-Forwarded-For", "203.0.113.5");

        assertThat(resolver(false).resolve(request)).isEqualTo("192.0.2.10");
    }

    private static ClientAddressResolver resolver(boolean trustForwarded) {
        return new ClientAddressResolver(TestAuthProperties.withRateLimit(
                new AuthProperties.RateLimit(true, 10, Duration.ofMinutes(1), trustForwarded, true)));
    }

    private static MockHttpServletRequest request() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/auth/login");
        request.setRemoteAddr("192.0.2.10");
        return request;
    }
}
