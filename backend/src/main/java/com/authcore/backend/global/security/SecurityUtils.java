package com.authcore.backend.global.security;

import java.util.UUID;

import com.authcore.backend.global.error.ErrorCategory;
import com.authcore.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new ProblemException(ErrorCategory.UNAUTHORIZED, "authentication required");
        }
        return principal;
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
