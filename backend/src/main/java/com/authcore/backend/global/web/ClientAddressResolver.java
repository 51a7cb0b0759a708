package com.authcore.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import com.authcore.backend.global.config.AuthProperties;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the client address used for rate limiting and refresh-token metadata.
 * Forwarding headers are honored only when {@code auth.rate-limit.trust-forwarded-headers} is set.
 */
@Component
public class ClientAddressResolver {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    static final String REAL_IP_HEADER = "X-Real-IP";

    private final boolean trustForwardedHeaders;

    public ClientAddressResolver(AuthProperties properties) {
        this.trustForwardedHeaders = properties.rateLimit().trustForwardedHeaders();
    }

    public String resolve(HttpServletRequest request) {
        if (trustForwardedHeaders) {
            String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
            if (StringUtils.hasText(forwardedFor)) {
                String first = forwardedFor.split(",")[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
            String realIp = request.getHeader(REAL_IP_HEADER);
            if (StringUtils.hasText(realIp)) {
                return realIp.trim();
            }
        }
        return request.getRemoteAddr();
    }
}
