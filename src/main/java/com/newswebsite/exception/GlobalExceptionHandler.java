package com.newswebsite.exception;

import com.newswebsite.config.AppProperties;
import com.newswebsite.dto.ApiResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to the JSON envelope. The raw exception message is only exposed
 * in the {@code error} field outside production.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    private final AppProperties appProperties;

    public GlobalExceptionHandler(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException ex) {
        LOG.warn("Validation failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    ResponseEntity<ApiResponse<Void>> handleAuthenticationFailed(AuthenticationFailedException ex) {
        LOG.warn("Login refused: {}", ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, ex.getMessage(), null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException ex) {
        LOG.warn("{} not found", ex.getResource());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    /**
     * Upload failed before anything was written (HTTP 500).
     */
    @ExceptionHandler(MediaUploadException.class)
    ResponseEntity<ApiResponse<Void>> handleMediaUpload(MediaUploadException ex) {
        LOG.error("Media upload failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getUserMessage(), ex);
    }

    @ExceptionHandler(NotificationException.class)
    ResponseEntity<ApiResponse<Void>> handleNotification(NotificationException ex) {
        LOG.error("Mail delivery failed for template {}", ex.getTemplate(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Error sending email. Please try again later.", ex);
    }

    /**
     * A unique constraint the service did not pre-check (HTTP 400).
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    ResponseEntity<ApiResponse<Void>> handleDataIntegrity(DataIntegrityViolationException ex) {
        LOG.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Request conflicts with existing data", ex);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        LOG.warn("Bad value for parameter '{}': {}", ex.getName(), ex.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid value for parameter '" + ex.getName() + "'", null);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MaxUploadSizeExceededException.class
    })
    ResponseEntity<ApiResponse<Void>> handleUnreadable(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request", ex);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    ResponseEntity<ApiResponse<Void>> handleNoRoute(NoResourceFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "Route not found", null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    ResponseEntity<ApiResponse<Void>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), null);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    ResponseEntity<ApiResponse<Void>> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex.getMessage(), null);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Something went wrong", ex);
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message, Exception detail) {
        ApiResponse<Void> body = detail != null && !appProperties.isProduction()
                ? ApiResponse.failure(message, detail.getMessage())
                : ApiResponse.failure(message);
        return ResponseEntity.status(status).body(body);
    }
}
