package com.newswebsite.service;

import com.newswebsite.config.AppProperties;
import com.newswebsite.dto.NewsletterSendRequest;
import com.newswebsite.dto.NewsletterSubscribeRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.Newsletter;
import com.newswebsite.exception.NotificationException;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.exception.ValidationException;
import com.newswebsite.repository.NewsletterRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Service
public class NewsletterService {

    private static final Logger LOG = LogManager.getLogger(NewsletterService.class);

    private static final String ALREADY_SUBSCRIBED = "This email is already subscribed to our newsletter";

    private final NewsletterRepository newsletterRepository;
    private final NotificationService notificationService;
    private final Executor mailExecutor;
    private final AppProperties appProperties;

    public NewsletterService(NewsletterRepository newsletterRepository,
                             NotificationService notificationService,
                             @Qualifier("mailExecutor") Executor mailExecutor,
                             AppProperties appProperties) {
        this.newsletterRepository = newsletterRepository;
        this.notificationService = notificationService;
        this.mailExecutor = mailExecutor;
        this.appProperties = appProperties;
    }

    /**
     * The row is committed before the confirmation mail goes out, so a mail failure
     * leaves the subscription in place.
     */
    public SubscriptionOutcome subscribe(NewsletterSubscribeRequest request) {
        Inputs.requireAll("Email address is required", request.getEmail());
        String email = request.getEmail().trim();
        if (!Inputs.isValidEmail(email)) {
            throw new ValidationException("Please provide a valid email address");
        }

        SubscriptionOutcome outcome = newsletterRepository.findByEmail(email)
                .map(existing -> reactivate(existing, request))
                .orElseGet(() -> new SubscriptionOutcome(insert(email, request), false));

        Newsletter subscriber = outcome.subscriber();
        notificationService.sendNewsletterConfirmationEmail(subscriber.getEmail(), subscriber.getFirstName());
        return outcome;
    }

    private SubscriptionOutcome reactivate(Newsletter existing, NewsletterSubscribeRequest request) {
        if (Boolean.TRUE.equals(existing.getIsActive())) {
            throw new ValidationException(ALREADY_SUBSCRIBED);
        }
        existing.setIsActive(true);
        if (!Inputs.isBlank(request.getFirstName())) {
            existing.setFirstName(request.getFirstName());
        }
        if (!Inputs.isBlank(request.getLastName())) {
            existing.setLastName(request.getLastName());
        }
        if (!Inputs.isBlank(request.getCountryCode())) {
            existing.setCountryCode(request.getCountryCode());
        }
        Newsletter saved = newsletterRepository.save(existing);
        LOG.info("Reactivated newsletter subscriber {}", saved.getId());
        return new SubscriptionOutcome(saved, true);
    }

    private Newsletter insert(String email, NewsletterSubscribeRequest request) {
        Newsletter subscriber = new Newsletter();
        subscriber.setEmail(email);
        subscriber.setFirstName(Inputs.isBlank(request.getFirstName()) ? null : request.getFirstName());
        subscriber.setLastName(Inputs.isBlank(request.getLastName()) ? null : request.getLastName());
        subscriber.setCountryCode(Inputs.isBlank(request.getCountryCode()) ? null : request.getCountryCode());
        subscriber.setIsActive(true);
        try {
            Newsletter saved = newsletterRepository.saveAndFlush(subscriber);
            LOG.info("New newsletter subscriber {}", saved.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new ValidationException(ALREADY_SUBSCRIBED);
        }
    }

    @Transactional
    public void unsubscribe(String email) {
        Inputs.requireAll("Email address is required", email);
        Newsletter subscriber = newsletterRepository.findByEmail(email.trim())
                .orElseThrow(() -> new ResourceNotFoundException("Email address"));
        if (!Boolean.TRUE.equals(subscriber.getIsActive())) {
            throw new ValidationException("This email is already unsubscribed");
        }
        subscriber.setIsActive(false);
        newsletterRepository.save(subscriber);
        LOG.info("Unsubscribed newsletter subscriber {}", subscriber.getId());
    }

    public Map<String, Long> stats() {
        long total = newsletterRepository.count();
        long active = newsletterRepository.countByIsActiveTrue();
        long recent = newsletterRepository.countByIsActiveTrueAndCreatedAtGreaterThanEqual(
                LocalDateTime.now().minusDays(30));

        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("totalSubscribers", total);
        stats.put("activeSubscribers", active);
        stats.put("inactiveSubscribers", total - active);
        stats.put("recentSubscribers", recent);
        return stats;
    }

    public PageResult<Newsletter> subscribers(PageQuery query) {
        return PageResult.of("subscribers", newsletterRepository.findByIsActiveTrue(
                PageRequest.of(query.getPage() - 1, query.getLimit(), Sort.by(Sort.Direction.DESC, "createdAt"))), query);
    }

    /**
     * Mails every active subscriber, one page of {@code app.newsletter.batch-size} at a time,
     * each page sent concurrently. Any failed delivery fails the whole call; pages already sent stay sent.
     *
     * @return {@code sent} recipients and number of {@code batches}
     */
    public Map<String, Integer> send(NewsletterSendRequest request) {
        Inputs.requireAll("Subject and content are required", request.getSubject(), request.getContent());

        int batchSize = Math.max(1, appProperties.getNewsletter().getBatchSize());
        int sent = 0;
        int batches = 0;
        int pageNumber = 0;
        while (true) {
            Page<Newsletter> page = newsletterRepository.findByIsActiveTrue(
                    PageRequest.of(pageNumber, batchSize, Sort.by(Sort.Direction.ASC, "id")));
            List<Newsletter> batch = page.getContent();
            if (batch.isEmpty()) {
                break;
            }
            dispatch(batch, request);
            sent += batch.size();
            batches++;
            LOG.info("Newsletter batch {} sent to {} subscribers", batches, batch.size());
            if (batch.size() < batchSize) {
                break;
            }
            pageNumber++;
        }
        Map<String, Integer> result = new LinkedHashMap<>();
        result.put("sent", sent);
        result.put("batches", batches);
        return result;
    }

    private void dispatch(List<Newsletter> batch, NewsletterSendRequest request) {
        CompletableFuture<?>[] deliveries = batch.stream()
                .map(subscriber -> CompletableFuture.runAsync(() -> notificationService.sendNewsletterEmail(
                        subscriber.getEmail(), subscriber.getFirstName(),
                        request.getSubject(), request.getContent()), mailExecutor))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(deliveries).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof NotificationException notificationException) {
                throw notificationException;
            }
            throw e;
        }
    }
}
