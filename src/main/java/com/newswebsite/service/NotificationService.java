package com.newswebsite.service;

import com.newswebsite.config.AppProperties;
import com.newswebsite.dto.ContactRequest;
import com.newswebsite.exception.NotificationException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.thymeleaf.ITemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.Year;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders {@code templates/email/<name>.html} inside the shared layout and sends it.
 * Every failure, rendering or transport, surfaces as {@link NotificationException}.
 */
@Service
public class NotificationService {

    private static final Logger LOG = LogManager.getLogger(NotificationService.class);

    private static final String TEMPLATE_DIR = "email/";
    private static final String LAYOUT = "layout";
    private static final DateTimeFormatter SUBMISSION_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final JavaMailSender mailSender;
    private final ITemplateEngine templateEngine;
    private final AppProperties appProperties;

    public NotificationService(JavaMailSender mailSender, ITemplateEngine templateEngine, AppProperties appProperties) {
        this.mailSender = mailSender;
        this.templateEngine = templateEngine;
        this.appProperties = appProperties;
    }

    public void sendVerificationEmail(String email, String verificationCode) {
        sendTemplatedEmail(email, "Verify Your Email Address", "verification",
                Map.of("verificationCode", verificationCode));
    }

    public void sendWelcomeEmail(String email) {
        sendTemplatedEmail(email, "Welcome to Our Platform", "welcome",
                Map.of("loginUrl", appProperties.getClientUrl() + "/login"));
    }

    public void sendPasswordResetEmail(String email, String resetUrl) {
        sendTemplatedEmail(email, "Password Reset Request", "password-reset",
                Map.of("resetURL", resetUrl));
    }

    public void sendContactFormEmail(ContactRequest contact) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("firstName", contact.getFirstName());
        variables.put("lastName", contact.getLastName());
        variables.put("email", contact.getEmail());
        variables.put("phone", contact.getPhone());
        variables.put("message", contact.getMessage());
        variables.put("submissionDate", LocalDateTime.now().format(SUBMISSION_FORMAT));
        sendTemplatedEmail(appProperties.getAdminEmail(), "New Contact Form Submission", "contact-form", variables);
    }

    public void sendContactAcknowledgementEmail(ContactRequest contact) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("firstName", contact.getFirstName());
        variables.put("lastName", contact.getLastName());
        variables.put("supportEmail", appProperties.getAdminEmail());
        sendTemplatedEmail(contact.getEmail(), "Thank you for contacting us - Message Received",
                "contact-acknowledgement", variables);
    }

    public void sendNewsletterConfirmationEmail(String email, String firstName) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("firstName", firstName != null ? firstName : "Subscriber");
        variables.put("siteUrl", appProperties.getClientUrl());
        sendTemplatedEmail(email, "Welcome to Our Newsletter", "newsletter-confirmation", variables);
    }

    public void sendNewsletterEmail(String email, String firstName, String subject, String content) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("firstName", firstName != null ? firstName : "Subscriber");
        variables.put("content", content);
        variables.put("siteUrl", appProperties.getClientUrl());
        sendTemplatedEmail(email, subject, "newsletter", variables);
    }

    public void sendTemplatedEmail(String to, String subject, String template, Map<String, Object> variables) {
        try {
            String html = render(subject, template, variables);

            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
            AppProperties.Mail mail = appProperties.getMail();
            helper.setFrom(new InternetAddress(mail.getFromAddress(), mail.getFromName(), StandardCharsets.UTF_8.name()));
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(html, true);

            mailSender.send(message);
            LOG.info("Sent '{}' email to {}", template, to);
        } catch (MessagingException | MailException | TemplateEngineException | UnsupportedEncodingException e) {
            LOG.error("Failed to send '{}' email to {}", template, to, e);
            throw new NotificationException(template, e);
        }
    }

    String render(String subject, String template, Map<String, Object> variables) {
        Context context = new Context();
        context.setVariables(variables);
        context.setVariable("appName", appProperties.getMail().getAppName());
        context.setVariable("currentYear", Year.now().getValue());
        context.setVariable("title", subject);

        String body = templateEngine.process(TEMPLATE_DIR + template, context);
        context.setVariable("body", body);
        return templateEngine.process(TEMPLATE_DIR + LAYOUT, context);
    }
}
