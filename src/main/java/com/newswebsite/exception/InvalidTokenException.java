package com.newswebsite.exception;

/**
 * Session token failed signature or expiry checks. Never shown to callers verbatim.
 */
public class InvalidTokenException extends NewsWebsiteException {

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
