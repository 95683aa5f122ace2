package com.newswebsite.controller;

import com.newswebsite.dto.ApiResponse;
import com.newswebsite.dto.EmailRequest;
import com.newswebsite.dto.NewsletterSendRequest;
import com.newswebsite.dto.NewsletterSubscribeRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.Newsletter;
import com.newswebsite.exception.NotificationException;
import com.newswebsite.service.NewsletterService;
import com.newswebsite.service.SubscriptionOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/newsletter")
public class NewsletterController {

    private static final Logger LOG = LogManager.getLogger(NewsletterController.class);

    private final NewsletterService newsletterService;

    public NewsletterController(NewsletterService newsletterService) {
        this.newsletterService = newsletterService;
    }

    @PostMapping("/subscribe")
    public ResponseEntity<ApiResponse<Map<String, Object>>> subscribe(@RequestBody NewsletterSubscribeRequest request) {
        SubscriptionOutcome outcome;
        try {
            outcome = newsletterService.subscribe(request);
        } catch (NotificationException e) {
            LOG.error("Newsletter confirmation mail failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.failure(
                    "Subscription saved but confirmation email could not be sent. Please contact support."));
        }
        if (outcome.reactivated()) {
            return ResponseEntity.ok(ApiResponse.success(
                    "Welcome back! Your newsletter subscription has been reactivated."));
        }
        Newsletter subscriber = outcome.subscriber();
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(
                "Thank you for subscribing! You will receive a confirmation email shortly.",
                Map.<String, Object>of("id", subscriber.getId(), "email", subscriber.getEmail())));
    }

    @PostMapping("/unsubscribe")
    public ResponseEntity<ApiResponse<Void>> unsubscribe(@RequestBody EmailRequest request) {
        newsletterService.unsubscribe(request.getEmail());
        return ResponseEntity.ok(ApiResponse.success("You have been successfully unsubscribed from our newsletter"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<Map<String, Long>>> stats() {
        return ResponseEntity.ok(ApiResponse.success("Newsletter statistics retrieved successfully",
                newsletterService.stats()));
    }

    @GetMapping("/subscribers")
    public ResponseEntity<ApiResponse<PageResult<Newsletter>>> subscribers(@RequestParam(required = false) Integer page,
                                                                          @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ApiResponse.success("Subscribers retrieved successfully",
                newsletterService.subscribers(PageQuery.of(page, limit))));
    }

    @PostMapping("/send")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> send(@RequestBody NewsletterSendRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Newsletter sent successfully", newsletterService.send(request)));
    }
}
