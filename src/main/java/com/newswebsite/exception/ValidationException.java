package com.newswebsite.exception;

/**
 * Malformed or missing input (HTTP 400).
 */
public class ValidationException extends NewsWebsiteException {

    public ValidationException(String message) {
        super(message);
    }
}
