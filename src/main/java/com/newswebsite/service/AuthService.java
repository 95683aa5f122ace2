package com.newswebsite.service;

import com.newswebsite.config.AppProperties;
import com.newswebsite.dto.LoginRequest;
import com.newswebsite.dto.ResetPasswordRequest;
import com.newswebsite.dto.SignupRequest;
import com.newswebsite.dto.VerifyOtpRequest;
import com.newswebsite.entity.Role;
import com.newswebsite.entity.User;
import com.newswebsite.exception.AuthenticationFailedException;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.exception.ValidationException;
import com.newswebsite.repository.UserRepository;
import com.newswebsite.security.JwtAuthenticationFilter;
import com.newswebsite.security.JwtService;
import com.newswebsite.security.OneTimeCodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseCookie;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Self-service account lifecycle: sign-up, e-mail verification, login, password reset.
 */
@Service
public class AuthService {

    private static final Logger LOG = LogManager.getLogger(AuthService.class);


    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final NotificationService notificationService;
    private final AppProperties appProperties;

    public AuthService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       JwtService jwtService,
                       NotificationService notificationService,
                       AppProperties appProperties) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.notificationService = notificationService;
        this.appProperties = appProperties;
    }

    /**
     * Registers an unverified EDITOR and mails a verification code. An earlier unverified
     * registration for the same address is replaced.
     */
    @Transactional
    public User signup(SignupRequest request) {
        Inputs.requireAll("Please provide email and password", request.getEmail(), request.getPassword());
        String email = request.getEmail().trim();
        if (!Inputs.isValidEmail(email)) {
            throw new ValidationException("Please provide a valid email address");
        }

        Optional<User> existing = userRepository.findByEmail(email);
        if (existing.isPresent()) {
            if (Boolean.TRUE.equals(existing.get().getIsVerified())) {
                throw new ValidationException("User with this email already exists");
            }
            userRepository.delete(existing.get());
            // the delete must reach the database before the insert reuses the unique email
            userRepository.flush();
            LOG.info("Replacing unverified registration for user {}", existing.get().getId());
        }

        String code = OneTimeCodes.verificationCode();
        User user = new User();
        user.setEmail(email);
        user.setName(request.getName());
        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setRole(Role.EDITOR);
        user.setIsVerified(false);
        user.setIsActive(true);
        user.setVerificationToken(code);
        user.setVerificationTokenExpires(LocalDateTime.now().plus(OneTimeCodes.VERIFICATION_CODE_TTL));
        User saved = userRepository.save(user);

        notificationService.sendVerificationEmail(saved.getEmail(), code);
        LOG.info("Registered user {}", saved.getId());
        return saved;
    }

    @Transactional
    public User verifyOtp(VerifyOtpRequest request) {
        Inputs.requireAll("Invalid or expired verification token", request.getEmail(), request.getToken());

        User user = userRepository.findFirstByEmailAndVerificationTokenAndVerificationTokenExpiresAfter(
                        request.getEmail().trim(), request.getToken().trim(), LocalDateTime.now())
                .orElseThrow(() -> new ValidationException("Invalid or expired verification token"));

        user.setIsVerified(true);
        user.setVerificationToken(null);
        user.setVerificationTokenExpires(null);
        userRepository.save(user);

        notificationService.sendWelcomeEmail(user.getEmail());
        LOG.info("Verified user {}", user.getId());
        return user;
    }

    @Transactional
    public void resendVerification(String email) {
        Inputs.requireAll("Email address is required", email);
        User user = userRepository.findByEmail(email.trim())
                .orElseThrow(() -> new ResourceNotFoundException("User"));
        if (Boolean.TRUE.equals(user.getIsVerified())) {
            throw new ValidationException("This account is already verified");
        }

        String code = OneTimeCodes.verificationCode();
        user.setVerificationToken(code);
        user.setVerificationTokenExpires(LocalDateTime.now().plus(OneTimeCodes.VERIFICATION_CODE_TTL));
        userRepository.save(user);

        notificationService.sendVerificationEmail(user.getEmail(), code);
    }

    /**
     * Checks run in a fixed order and the first failing one decides the message.
     */
    public LoginResult login(LoginRequest request) {
        Inputs.requireAll("Please provide email and password", request.getEmail(), request.getPassword());

        User user = userRepository.findByEmail(request.getEmail().trim())
                .orElseThrow(() -> new AuthenticationFailedException("User does not exist"));
        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            LOG.warn("Wrong password for user {}", user.getId());
            throw new AuthenticationFailedException("Invalid credentials");
        }
        if (!Boolean.TRUE.equals(user.getIsActive())) {
            throw new AuthenticationFailedException("Your account is not active please contact admin");
        }
        if (!Boolean.TRUE.equals(user.getIsVerified())) {
            throw new AuthenticationFailedException("Please verify your email before logging in");
        }

        LOG.info("User {} logged in", user.getId());
        return new LoginResult(jwtService.generateToken(user), user);
    }

    @Transactional
    public void forgotPassword(String email) {
        Inputs.requireAll("Email address is required", email);
        User user = userRepository.findByEmail(email.trim())
                .orElseThrow(() -> new ResourceNotFoundException("User"));

        String rawToken = OneTimeCodes.resetToken();
        user.setResetPasswordToken(OneTimeCodes.sha256Hex(rawToken));
        user.setResetPasswordExpires(LocalDateTime.now().plus(OneTimeCodes.RESET_TOKEN_TTL));
        userRepository.save(user);

        String resetUrl = appProperties.getClientUrl() + "/reset-password/" + rawToken;
        notificationService.sendPasswordResetEmail(user.getEmail(), resetUrl);
        LOG.info("Password reset requested for user {}", user.getId());
    }

    /**
     * @param queryToken {@code ?token=} fallback when the body carries none
     */
    @Transactional
    public void resetPassword(ResetPasswordRequest request, String queryToken) {
        String rawToken = !Inputs.isBlank(request.getToken()) ? request.getToken() : queryToken;
        if (Inputs.isBlank(rawToken)) {
            throw new ValidationException("Reset token is required");
        }
        if (Inputs.isBlank(request.getPassword())) {
            throw new ValidationException("Password is required");
        }

        User user = userRepository.findFirstByResetPasswordTokenAndResetPasswordExpiresAfter(
                        OneTimeCodes.sha256Hex(rawToken.trim()), LocalDateTime.now())
                .orElseThrow(() -> new ValidationException("Token is invalid or has expired"));

        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setResetPasswordToken(null);
        user.setResetPasswordExpires(null);
        userRepository.save(user);
        LOG.info("Password reset completed for user {}", user.getId());
    }

    public User currentUser(Long id) {
        return userRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("User"));
    }

    public ResponseCookie sessionCookie(String token) {
        return ResponseCookie.from(JwtAuthenticationFilter.COOKIE_NAME, token)
                .httpOnly(true)
                .secure(appProperties.isProduction())
                .path("/")
                .maxAge(Duration.ofDays(appProperties.getJwt().getCookieExpirationDays()))
                .build();
    }

    public ResponseCookie logoutCookie() {
        return ResponseCookie.from(JwtAuthenticationFilter.COOKIE_NAME, JwtAuthenticationFilter.LOGGED_OUT_VALUE)
                .httpOnly(true)
                .path("/")
                .maxAge(Duration.ofSeconds(10))
                .build();
    }
}
