package com.newswebsite.security;

import com.newswebsite.entity.User;
import com.newswebsite.exception.InvalidTokenException;
import com.newswebsite.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Derives the caller from the {@code jwt} cookie or a Bearer header.
 *
 * <p>Never rejects a request on its own: when the token is missing or bad the request
 * continues anonymously and the reason is left in {@link #AUTH_FAILURE_ATTRIBUTE} for
 * {@link RestAuthenticationEntryPoint} to report if the route turns out to be protected.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger LOG = LogManager.getLogger(JwtAuthenticationFilter.class);

    public static final String COOKIE_NAME = "jwt";
    /** Cookie value written on logout; carries no session. */
    public static final String LOGGED_OUT_VALUE = "loggedout";
    public static final String AUTH_FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".FAILURE";

    static final String NOT_LOGGED_IN = "You are not logged in. Please log in to get access.";
    static final String USER_GONE = "The user belonging to this token no longer exists.";
    static final String USER_INACTIVE = "Your account is not active. Please contact admin.";
    static final String TOKEN_INVALID = "Invalid token or authentication failed.";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;
    private final UserRepository userRepository;

    public JwtAuthenticationFilter(JwtService jwtService, UserRepository userRepository) {
        this.jwtService = jwtService;
        this.userRepository = userRepository;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Optional<String> token = resolveToken(request);
        if (token.isEmpty()) {
            request.setAttribute(AUTH_FAILURE_ATTRIBUTE, NOT_LOGGED_IN);
        } else {
            authenticate(token.get(), request);
        }
        chain.doFilter(request, response);
    }

    private void authenticate(String token, HttpServletRequest request) {
        TokenClaims claims;
        try {
            claims = jwtService.parse(token);
        } catch (InvalidTokenException e) {
            LOG.debug("Rejected session token: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            request.setAttribute(AUTH_FAILURE_ATTRIBUTE, TOKEN_INVALID);
            return;
        }

        Optional<User> user = userRepository.findById(claims.userId());
        if (user.isEmpty()) {
            request.setAttribute(AUTH_FAILURE_ATTRIBUTE, USER_GONE);
            return;
        }
        if (!Boolean.TRUE.equals(user.get().getIsActive())) {
            request.setAttribute(AUTH_FAILURE_ATTRIBUTE, USER_INACTIVE);
            return;
        }

        SecurityContextHolder.getContext().setAuthentication(new AuthenticatedUser(user.get()));
        ThreadContext.put("userId", String.valueOf(claims.userId()));
    }

    static Optional<String> resolveToken(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (COOKIE_NAME.equals(cookie.getName()) && cookie.getValue() != null
                        && !cookie.getValue().isBlank() && !LOGGED_OUT_VALUE.equals(cookie.getValue())) {
                    return Optional.of(cookie.getValue());
                }
            }
        }
        String header = request.getHeader("Authorization");
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String value = header.substring(BEARER_PREFIX.length()).trim();
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
