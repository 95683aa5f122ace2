package com.newswebsite.exception;

/**
 * Login refused: unknown account, wrong password, inactive or unverified (HTTP 401).
 */
public class AuthenticationFailedException extends NewsWebsiteException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
