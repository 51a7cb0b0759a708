package com.authcore.backend.global.security;

import java.io.IOException;
import java.util.List;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import com.authcore.backend.global.error.ProblemException;
import com.authcore.backend.global.web.ErrorResponseWriter;
import com.authcore.backend.modules.auth.application.AccessClaims;
import com.authcore.backend.modules.auth.application.AuthService;

import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code Authorization: Bearer} requests through {@link AuthService#validateAccess},
 * so a denylisted token is rejected even while its signature is still valid.
 * Requests without the header pass through and are judged by the authorization rules.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;
    private final ErrorResponseWriter errorResponseWriter;

    public JwtAuthenticationFilter(AuthService authService, ErrorResponseWriter errorResponseWriter) {
        this.authService = authService;
        this.errorResponseWriter = errorResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            try {
                AccessClaims claims = authService.validateAccess(token);
                JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(claims.userId(), claims.email());
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, List.of());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (ProblemException ex) {
                SecurityContextHolder.clearContext();
                errorResponseWriter.write(response, ex.getCategory(), ex.getDetailMessage());
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getServletPath();
        return SecurityConfig.PUBLIC_AUTH_PATHS.contains(path)
                || path.startsWith("/health")
                || path.startsWith("/actuator");
    }
}
