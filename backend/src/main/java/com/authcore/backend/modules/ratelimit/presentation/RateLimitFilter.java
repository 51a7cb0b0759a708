package com.authcore.backend.modules.ratelimit.presentation;

import java.io.IOException;
import java.util.Set;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.global.error.ErrorCategory;
import com.authcore.backend.global.store.StoreException;
import com.authcore.backend.global.web.ClientAddressResolver;
import com.authcore.backend.global.web.ErrorResponseWriter;
import com.authcore.backend.modules.ratelimit.application.RateLimitDecision;
import com.authcore.backend.modules.ratelimit.application.SlidingWindowRateLimiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Throttles the unauthenticated credential endpoints per client address. Register, login and
 * refresh share one window, so rotating between them gains nothing.
 * Registered in the security chain by {@link com.authcore.backend.global.security.SecurityConfig}.
 */
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final Set<String> GUARDED_PATHS = Set.of(
            "/api/v1/auth/register",
            "/api/v1/auth/login",
            "/api/v1/auth/refresh"
    );

    private final SlidingWindowRateLimiter rateLimiter;
    private final ClientAddressResolver clientAddressResolver;
    private final ErrorResponseWriter errorResponseWriter;
    private final AuthProperties.RateLimit settings;

    public RateLimitFilter(
            SlidingWindowRateLimiter rateLimiter,
            ClientAddressResolver clientAddressResolver,
            ErrorResponseWriter errorResponseWriter,
            AuthProperties properties
    ) {
        this.rateLimiter = rateLimiter;
        this.clientAddressResolver = clientAddressResolver;
        this.errorResponseWriter = errorResponseWriter;
        this.settings = properties.rateLimit();
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !settings.enabled()
                || !HttpMethod.POST.matches(request.getMethod())
                || !GUARDED_PATHS.contains(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String clientKey = clientAddressResolver.resolve(request);
        RateLimitDecision decision;
        try {
            decision = rateLimiter.allow(clientKey, settings.requests(), settings.window());
        } catch (StoreException ex) {
            if (settings.failOpen()) {
                log.warn("Rate limiter unavailable, admitting {} {}", request.getMethod(), request.getRequestURI(), ex);
                filterChain.doFilter(request, response);
                return;
            }
            log.error("Rate limiter unavailable, rejecting {} {}", request.getMethod(), request.getRequestURI(), ex);
            errorResponseWriter.write(response, ErrorCategory.UNAVAILABLE, "service temporarily unavailable");
            return;
        }

        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        if (!decision.allowed()) {
            long retryAfterSeconds = decision.retryAfterSeconds();
            log.info("Rate limit exceeded for {} on {}", clientKey, request.getRequestURI());
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
            errorResponseWriter.write(response, ErrorCategory.RATE_LIMITED,
                    "rate limit exceeded, try again in " + retryAfterSeconds + "s");
            return;
        }
        filterChain.doFilter(request, response);
    }
}
