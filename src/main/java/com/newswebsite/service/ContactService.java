package com.newswebsite.service;

import com.newswebsite.dto.ContactRequest;
import com.newswebsite.exception.NotificationException;
import com.newswebsite.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Contact form: mails the site admin and acknowledges the sender. Nothing is stored.
 */
@Service
public class ContactService {

    private static final Logger LOG = LogManager.getLogger(ContactService.class);

    private final NotificationService notificationService;
    private final Executor mailExecutor;

    public ContactService(NotificationService notificationService,
                          @Qualifier("mailExecutor") Executor mailExecutor) {
        this.notificationService = notificationService;
        this.mailExecutor = mailExecutor;
    }

    /**
     * Sends both mails concurrently and returns once both are delivered.
     */
    public void submit(ContactRequest request) {
        Inputs.requireAll("Please provide all required fields",
                request.getFirstName(), request.getLastName(), request.getEmail(), request.getMessage());
        if (!Inputs.isValidEmail(request.getEmail().trim())) {
            throw new ValidationException("Please provide a valid email address");
        }

        CompletableFuture<Void> toAdmin = CompletableFuture.runAsync(
                () -> notificationService.sendContactFormEmail(request), mailExecutor);
        CompletableFuture<Void> toSender = CompletableFuture.runAsync(
                () -> notificationService.sendContactAcknowledgementEmail(request), mailExecutor);
        try {
            CompletableFuture.allOf(toAdmin, toSender).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof NotificationException notificationException) {
                throw notificationException;
            }
            throw e;
        }
        LOG.info("Contact form delivered");
    }
}
