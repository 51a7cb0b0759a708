package com.authcore.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import com.authcore.backend.global.error.ErrorCategory;
import com.authcore.backend.global.error.ProblemException;
import com.authcore.backend.global.web.ErrorResponseWriter;
import com.authcore.backend.modules.auth.application.AccessClaims;
import com.authcore.backend.modules.auth.application.AuthService;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    private static final UUID USER_ID = UUID.fromString("3f8a2c4e-1b7d-4e9a-9c1f-6d2b8e4a7c10");

    @Mock
    private AuthService authService;

    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(authService, new ErrorResponseWriter(new ObjectMapper()));
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void validBearerTokenAuthenticatesTheRequest() throws Exception {
        when(authService.validateAccess("good-token")).thenReturn(
                new AccessClaims(USER_ID, "alice@example.com", Instant.EPOCH, Instant.EPOCH.plusSeconds(900)));
        AtomicReference<JwtAuthenticationPrincipal> seen = new AtomicReference<>();

        filter.doFilter(bearer("good-token"), new MockHttpServletResponse(),
                (req, res) -> seen.set(SecurityUtils.getCurrentPrincipal()));

        assertThat(seen.get()).isEqualTo(new JwtAuthenticationPrincipal(USER_ID, "alice@example.com"));
    }

    @Test
    void rejectedTokenStopsTheChainWithCategoryStatus() throws Exception {
        when(authService.validateAccess("revoked-token"))
                .thenThrow(new ProblemException(ErrorCategory.UNAUTHORIZED, "invalid or expired token"));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(bearer("revoked-token"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("\"error\":\"unauthorized\"");
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void publicCredentialEndpointsSkipTokenValidation() throws Exception {
        MockHttpServletRequest request = bearer("stale-token");
        request.setRequestURI("/api/v1/auth/login");
        request.setServletPath("/api/v1/auth/login");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        verifyNoInteractions(authService);
    }

    private static MockHttpServletRequest bearer(String token) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auth/me");
        request.setServletPath("/api/v1/auth/me");
        request.addHeader("Authorization", "Bearer " + token);
        return request;
    }
}
