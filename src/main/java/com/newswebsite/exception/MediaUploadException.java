package com.newswebsite.exception;

/**
 * The object store rejected an upload. Thrown before any database write.
 */
public class MediaUploadException extends NewsWebsiteException {

    private final String userMessage;

    public MediaUploadException(String userMessage, String detail) {
        super(detail);
        this.userMessage = userMessage;
    }

    public MediaUploadException(String userMessage, Throwable cause) {
        super(cause.getMessage(), cause);
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
