package com.newswebsite.exception;

/**
 * Outbound mail could not be rendered or handed to the relay.
 */
public class NotificationException extends NewsWebsiteException {

    private final String template;

    public NotificationException(String template, Throwable cause) {
        super("Failed to send '" + template + "' email: " + cause.getMessage(), cause);
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
