package com.newswebsite.exception;

/**
 * Base exception for all application-specific errors.
 * Subclasses map to one HTTP status each in {@link GlobalExceptionHandler}.
 */
public class NewsWebsiteException extends RuntimeException {

    public NewsWebsiteException(String message) {
        super(message);
    }

    public NewsWebsiteException(String message, Throwable cause) {
        super(message, cause);
    }
}
