package com.authcore.backend.global.web;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import jakarta.servlet.http.HttpServletResponse;

import com.authcore.backend.global.error.ErrorCategory;
import com.authcore.backend.global.error.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes the standard error body from servlet filters, which run outside
 * {@link com.authcore.backend.global.error.RestExceptionHandler}.
 */
@Component
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;

    public ErrorResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, ErrorCategory category, String message) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(category.status().value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), ErrorResponse.of(category, message));
    }
}
