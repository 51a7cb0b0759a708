package com.authcore.backend.global.error;

import jakarta.servlet.ServletException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ErrorResponse> handleProblemException(ProblemException ex) {
        ErrorCategory category = ex.getCategory();
        return ResponseEntity.status(category.status()).body(ErrorResponse.of(category, ex.getDetailMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        String code = status.name().toLowerCase();
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "validation failed";
        ErrorCategory category = ErrorCategory.INVALID_INPUT;
        return ResponseEntity.status(category.status()).body(ErrorResponse.of(category, detail));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ErrorCategory category = ErrorCategory.INVALID_INPUT;
        return ResponseEntity.status(category.status()).body(ErrorResponse.of(category, "request body is missing or malformed"));
    }

    /**
     * Spring MVC rejections of the request itself: unsupported media type or method, unknown path,
     * missing parameter. The framework status is kept; only 5xx rejections fall through.
     */
    @ExceptionHandler(ServletException.class)
    public ResponseEntity<ErrorResponse> handleRejectedRequest(ServletException ex) {
        if (!(ex instanceof org.springframework.web.ErrorResponse)) {
            return handleGenericException(ex);
        }
        org.springframework.web.ErrorResponse rejection = (org.springframework.web.ErrorResponse) ex;
        HttpStatusCode status = rejection.getStatusCode();
        if (!status.is4xxClientError()) {
            return handleGenericException(ex);
        }
        log.debug("Rejected request: {}", ex.getMessage());
        ErrorCategory category = ErrorCategory.INVALID_INPUT;
        return ResponseEntity.status(status)
                .headers(rejection.getHeaders())
                .body(ErrorResponse.of(category, rejectionMessage(rejection)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception", ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(new ErrorResponse(ErrorResponse.INTERNAL_ERROR, "internal server error"));
    }

    private static String rejectionMessage(org.springframework.web.ErrorResponse rejection) {
        ProblemDetail body = rejection.getBody();
        if (body.getDetail() != null && !body.getDetail().isBlank()) {
            return body.getDetail();
        }
        HttpStatus status = HttpStatus.resolve(rejection.getStatusCode().value());
        return status != null ? status.getReasonPhrase() : "invalid request";
    }
}
