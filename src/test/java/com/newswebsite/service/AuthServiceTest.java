package com.newswebsite.service;

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
import com.newswebsite.security.JwtService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class AuthServiceTest {

    private static final String EMAIL = "editor@example.se";
    private static final String PASSWORD = "s3cret-pass";

    @Autowired
    private AuthService authService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private JwtService jwtService;

    @MockBean
    private NotificationService notificationService;

    @MockBean
    private MediaStorage mediaStorage;

    @BeforeEach
    void setUp() {
        userRepository.deleteAll();
    }

    @Test
    void signupCreatesUnverifiedEditorAndMailsCode() {
        User user = authService.signup(new SignupRequest(EMAIL, PASSWORD, "Edit Or"));

        assertThat(user.getRole()).isEqualTo(Role.EDITOR);
        assertThat(user.getIsVerified()).isFalse();
        assertThat(user.getPassword()).isNotEqualTo(PASSWORD);
        assertThat(passwordEncoder.matches(PASSWORD, user.getPassword())).isTrue();
        verify(notificationService).sendVerificationEmail(EMAIL, user.getVerificationToken());
    }

    @Test
    void signupForVerifiedAddressIsRejected() {
        userRepository.save(user(EMAIL, Role.EDITOR, true, true));

        assertThatThrownBy(() -> authService.signup(new SignupRequest(EMAIL, PASSWORD, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("User with this email already exists");
    }

    @Test
    void signupReplacesEarlierUnverifiedRegistration() {
        User first = authService.signup(new SignupRequest(EMAIL, PASSWORD, "First"));

        User second = authService.signup(new SignupRequest(EMAIL, "another-pass", "Second"));

        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(userRepository.findAll()).hasSize(1);
        assertThat(userRepository.findByEmail(EMAIL).orElseThrow().getName()).isEqualTo("Second");
    }

    @Test
    void signupRejectsMalformedEmail() {
        assertThatThrownBy(() -> authService.signup(new SignupRequest("editor-at-example", PASSWORD, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Please provide a valid email address");
    }

    @Test
    void verificationCodeWorksOnce() {
        authService.signup(new SignupRequest(EMAIL, PASSWORD, null));
        String code = sentVerificationCode();

        authService.verifyOtp(new VerifyOtpRequest(EMAIL, code));

        User verified = userRepository.findByEmail(EMAIL).orElseThrow();
        assertThat(verified.getIsVerified()).isTrue();
        assertThat(verified.getVerificationToken()).isNull();
        assertThat(verified.getVerificationTokenExpires()).isNull();
        verify(notificationService).sendWelcomeEmail(EMAIL);

        assertThatThrownBy(() -> authService.verifyOtp(new VerifyOtpRequest(EMAIL, code)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid or expired verification token");
    }

    @Test
    void expiredVerificationCodeIsRejected() {
        User user = authService.signup(new SignupRequest(EMAIL, PASSWORD, null));
        user.setVerificationTokenExpires(LocalDateTime.now().minusMinutes(1));
        userRepository.saveAndFlush(user);

        assertThatThrownBy(() -> authService.verifyOtp(new VerifyOtpRequest(EMAIL, user.getVerificationToken())))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid or expired verification token");
        verify(notificationService, never()).sendWelcomeEmail(anyString());
    }

    @Test
    void resendForVerifiedAccountIsRejected() {
        userRepository.save(user(EMAIL, Role.EDITOR, true, true));

        assertThatThrownBy(() -> authService.resendVerification(EMAIL))
                .isInstanceOf(ValidationException.class)
                .hasMessage("This account is already verified");
    }

    @Test
    void resendForUnknownAddressIsNotFound() {
        assertThatThrownBy(() -> authService.resendVerification("ghost@example.se"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void loginIssuesTokenForVerifiedActiveUser() {
        User saved = userRepository.save(user(EMAIL, Role.ADMIN, true, true));

        LoginResult result = authService.login(new LoginRequest(EMAIL, PASSWORD));

        assertThat(result.user().getId()).isEqualTo(saved.getId());
        assertThat(jwtService.parse(result.token()).userId()).isEqualTo(saved.getId());
        assertThat(jwtService.parse(result.token()).role()).isEqualTo("ADMIN");
    }

    @Test
    void loginChecksRunInOrder() {
        assertThatThrownBy(() -> authService.login(new LoginRequest(EMAIL, PASSWORD)))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("User does not exist");

        userRepository.save(user(EMAIL, Role.EDITOR, false, false));
        assertThatThrownBy(() -> authService.login(new LoginRequest(EMAIL, "wrong")))
                .hasMessage("Invalid credentials");
        assertThatThrownBy(() -> authService.login(new LoginRequest(EMAIL, PASSWORD)))
                .hasMessage("Your account is not active please contact admin");

        User user = userRepository.findByEmail(EMAIL).orElseThrow();
        user.setIsActive(true);
        userRepository.save(user);
        assertThatThrownBy(() -> authService.login(new LoginRequest(EMAIL, PASSWORD)))
                .hasMessage("Please verify your email before logging in");
    }

    @Test
    void resetTokenChangesPasswordOnce() {
        userRepository.save(user(EMAIL, Role.EDITOR, true, true));

        authService.forgotPassword(EMAIL);
        String rawToken = sentResetToken();
        User pending = userRepository.findByEmail(EMAIL).orElseThrow();
        assertThat(pending.getResetPasswordToken()).isNotEqualTo(rawToken).hasSize(64);

        authService.resetPassword(new ResetPasswordRequest(rawToken, "new-pass-123"), null);

        User reset = userRepository.findByEmail(EMAIL).orElseThrow();
        assertThat(passwordEncoder.matches("new-pass-123", reset.getPassword())).isTrue();
        assertThat(reset.getResetPasswordToken()).isNull();
        assertThat(reset.getResetPasswordExpires()).isNull();

        assertThatThrownBy(() -> authService.resetPassword(new ResetPasswordRequest(rawToken, "again"), null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Token is invalid or has expired");
    }

    @Test
    void resetTokenFromQueryIsAccepted() {
        userRepository.save(user(EMAIL, Role.EDITOR, true, true));
        authService.forgotPassword(EMAIL);
        String rawToken = sentResetToken();

        authService.resetPassword(new ResetPasswordRequest(null, "new-pass-123"), rawToken);

        assertThat(passwordEncoder.matches("new-pass-123",
                userRepository.findByEmail(EMAIL).orElseThrow().getPassword())).isTrue();
    }

    @Test
    void expiredResetTokenIsRejected() {
        userRepository.save(user(EMAIL, Role.EDITOR, true, true));
        authService.forgotPassword(EMAIL);
        String rawToken = sentResetToken();
        User user = userRepository.findByEmail(EMAIL).orElseThrow();
        user.setResetPasswordExpires(LocalDateTime.now().minusSeconds(1));
        userRepository.saveAndFlush(user);

        assertThatThrownBy(() -> authService.resetPassword(new ResetPasswordRequest(rawToken, "new-pass-123"), null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Token is invalid or has expired");
    }

    @Test
    void forgotPasswordForUnknownAddressIsNotFound() {
        assertThatThrownBy(() -> authService.forgotPassword("ghost@example.se"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("User not found");
    }

    @Test
    void logoutCookieOverwritesSession() {
        assertThat(authService.logoutCookie().getValue()).isEqualTo("loggedout");
        assertThat(authService.logoutCookie().getMaxAge().getSeconds()).isEqualTo(10);
        assertThat(authService.sessionCookie("abc").isHttpOnly()).isTrue();
    }

    private String sentVerificationCode() {
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(notificationService).sendVerificationEmail(eq(EMAIL), code.capture());
        return code.getValue();
    }

    private String sentResetToken() {
        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        verify(notificationService).sendPasswordResetEmail(eq(EMAIL), url.capture());
        assertThat(url.getValue()).startsWith("http://localhost:3000/reset-password/");
        return url.getValue().substring(url.getValue().lastIndexOf('/') + 1);
    }

    private User user(String email, Role role, boolean active, boolean verified) {
        User user = new User();
        user.setEmail(email);
        user.setPassword(passwordEncoder.encode(PASSWORD));
        user.setRole(role);
        user.setIsActive(active);
        user.setIsVerified(verified);
        return user;
    }
}
