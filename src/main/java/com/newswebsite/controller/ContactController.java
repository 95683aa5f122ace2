package com.newswebsite.controller;

import com.newswebsite.dto.ApiResponse;
import com.newswebsite.dto.ContactRequest;
import com.newswebsite.exception.NotificationException;
import com.newswebsite.service.ContactService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/contact")
public class ContactController {

    private static final Logger LOG = LogManager.getLogger(ContactController.class);

    private final ContactService contactService;

    public ContactController(ContactService contactService) {
        this.contactService = contactService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Void>> submit(@RequestBody ContactRequest request) {
        try {
            contactService.submit(request);
        } catch (NotificationException e) {
            LOG.error("Contact form mail failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.failure("Email service is currently unavailable. Please try again later."));
        }
        return ResponseEntity.ok(ApiResponse.success("Dear " + request.getFirstName()
                + ", Your message has been sent successfully. You will receive a confirmation email shortly."));
    }
}
